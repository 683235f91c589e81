package com.example.ample.infrastructure.lastfm;

import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Password-based session bootstrap ({@code auth.getMobileSession}).
 */
@Component
public class LastFmSessionClient {

    static final String METHOD_MOBILE_SESSION = "auth.getMobileSession";

    private final LastFmTransport transport;

    public LastFmSessionClient(LastFmTransport transport) {
        this.transport = transport;
    }

    /**
     * @return the long-lived session key
     */
    public String requestMobileSession(String apiKey, String apiSecret, String username, String password) {
        Map<String, String> params = new HashMap<>();
        params.put("method", METHOD_MOBILE_SESSION);
        params.put("api_key", apiKey);
        params.put("username", username);
        params.put("password", password);

        JsonNode root = transport.postSigned(params, apiSecret);
        String key = root.path("session").path("key").asText("");
        if (key.isEmpty()) {
            throw new ScrobblerException(ErrorKind.PROTOCOL, LastFmTransport.CODE_BAD_RESPONSE,
                    "auth.getMobileSession response has no session key");
        }
        return key;
    }
}
