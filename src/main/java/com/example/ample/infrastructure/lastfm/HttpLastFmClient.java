package com.example.ample.infrastructure.lastfm;

import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.example.ample.domain.model.LastFmCredentials;
import com.example.ample.domain.model.TrackInfo;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class HttpLastFmClient implements LastFmClient {

    static final String METHOD_NOW_PLAYING = "track.updateNowPlaying";
    static final String METHOD_SCROBBLE = "track.scrobble";
    static final String METHOD_TRACK_INFO = "track.getInfo";

    private final LastFmTransport transport;
    private final LastFmCredentials credentials;

    public HttpLastFmClient(LastFmTransport transport, LastFmCredentials credentials) {
        this.transport = transport;
        this.credentials = credentials;
    }

    @Override
    public void nowPlaying(String artist, String track, String album) {
        Map<String, String> params = authenticatedParams(METHOD_NOW_PLAYING, artist, track, album);
        transport.postSigned(params, credentials.getApiSecret());
    }

    @Override
    public void scrobble(String artist, String track, Instant startedAt, String album) {
        Map<String, String> params = authenticatedParams(METHOD_SCROBBLE, artist, track, album);
        params.put("timestamp", String.valueOf(startedAt.getEpochSecond()));
        JsonNode root = transport.postSigned(params, credentials.getApiSecret());
        JsonNode ignored = root.path("scrobbles").path("@attr").path("ignored");
        if (ignored.asInt(0) > 0) {
            throw new ScrobblerException(ErrorKind.REJECTED, "LASTFM_SCROBBLE_IGNORED",
                    "LastFM ignored the scrobble of " + track + " by " + artist);
        }
    }

    @Override
    public TrackInfo getTrackInfo(String artist, String track) {
        Map<String, String> params = new HashMap<>();
        params.put("method", METHOD_TRACK_INFO);
        params.put("api_key", credentials.getApiKey());
        params.put("artist", artist);
        params.put("track", track);
        return parseTrackInfo(transport.get(params));
    }

    static TrackInfo parseTrackInfo(JsonNode root) {
        JsonNode trackNode = root.path("track");
        if (!trackNode.isObject()) {
            throw new ScrobblerException(ErrorKind.PROTOCOL, LastFmTransport.CODE_BAD_RESPONSE,
                    "track.getInfo response has no track object");
        }
        JsonNode album = trackNode.path("album");
        List<TrackInfo.Image> images = new ArrayList<>();
        JsonNode imageNodes = album.has("image") ? album.path("image") : album.path("images");
        if (imageNodes.isArray()) {
            for (JsonNode image : imageNodes) {
                String url = image.has("#text") ? image.path("#text").asText("") : image.path("url").asText("");
                images.add(new TrackInfo.Image(image.path("size").asText(""), url));
            }
        }
        return new TrackInfo(
                trackNode.path("name").asText(""),
                trackNode.path("artist").path("name").asText(""),
                album.path("artist").asText(""),
                album.path("title").asText(""),
                images);
    }

    private Map<String, String> authenticatedParams(String method, String artist, String track, String album) {
        Map<String, String> params = new HashMap<>();
        params.put("method", method);
        params.put("artist", artist);
        params.put("track", track);
        params.put("api_key", credentials.getApiKey());
        params.put("sk", credentials.getSessionToken());
        if (album != null && !album.trim().isEmpty()) {
            params.put("album", album);
        }
        return params;
    }
}
