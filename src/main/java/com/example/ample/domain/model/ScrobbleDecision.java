package com.example.ample.domain.model;

import java.util.Collections;
import java.util.List;
import lombok.Data;

@Data
public class ScrobbleDecision {

    private static final ScrobbleDecision IDLE = new ScrobbleDecision(false, false, Collections.emptyList());

    private final boolean playing;

    private final boolean newTrack;

    private final List<ScrobbleAction> actions;

    public static ScrobbleDecision idle() {
        return IDLE;
    }

    public static ScrobbleDecision playing(boolean newTrack, List<ScrobbleAction> actions) {
        return new ScrobbleDecision(true, newTrack, Collections.unmodifiableList(actions));
    }
}
