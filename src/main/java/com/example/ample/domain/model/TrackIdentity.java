package com.example.ample.domain.model;

import lombok.Data;

/**
 * What is playing, independent of how far along it is. Two samples of the same track compare equal
 * however far the playback position has advanced.
 */
@Data
public class TrackIdentity {

    private final String playerName;

    private final String artistName;

    private final String songName;

    private final String albumName;

    public TrackIdentity(String playerName, String artistName, String songName, String albumName) {
        this.playerName = nullToEmpty(playerName);
        this.artistName = nullToEmpty(artistName);
        this.songName = nullToEmpty(songName);
        this.albumName = nullToEmpty(albumName);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
