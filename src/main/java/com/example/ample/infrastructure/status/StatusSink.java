package com.example.ample.infrastructure.status;

import com.example.ample.domain.model.StatusView;

/**
 * Where "now playing" is displayed outside LastFM.
 */
public interface StatusSink {

    void show(StatusView view);

    void clear();
}
