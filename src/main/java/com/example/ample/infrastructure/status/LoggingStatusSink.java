package com.example.ample.infrastructure.status;

import com.example.ample.domain.model.StatusView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes status changes to the log. Repeated identical views are logged at DEBUG only.
 */
@Component
public class LoggingStatusSink implements StatusSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingStatusSink.class);

    private StatusView shown;

    @Override
    public synchronized void show(StatusView view) {
        boolean changed = shown == null
                || !shown.getTitle().equals(view.getTitle())
                || !shown.getSubtitle().equals(view.getSubtitle())
                || !shown.getArtworkUrl().equals(view.getArtworkUrl());
        if (changed) {
            log.info("Status set, title={}, subtitle={}, start={}, end={}, artwork={}",
                    view.getTitle(), view.getSubtitle(), view.getStartEpochSecond(), view.getEndEpochSecond(),
                    view.getArtworkUrl().isEmpty() ? "-" : view.getArtworkUrl());
        } else {
            log.debug("Status refreshed, title={}, end={}", view.getTitle(), view.getEndEpochSecond());
        }
        shown = view;
    }

    @Override
    public synchronized void clear() {
        if (shown != null) {
            log.info("Status cleared, previousTitle={}", shown.getTitle());
            shown = null;
        }
    }

    synchronized StatusView getShown() {
        return shown;
    }
}
