package com.example.ample.infrastructure.lastfm;

import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.example.ample.domain.model.SignedRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP leg of every LastFM call. Authenticated mutations are signed form POSTs, lookups are plain
 * GETs. Any status outside 2xx is a failure regardless of body; each failure source maps to exactly
 * one {@link ErrorKind}.
 */
@Component
public class LastFmTransport {

    private static final Logger log = LoggerFactory.getLogger(LastFmTransport.class);

    static final String CODE_TRANSPORT = "LASTFM_TRANSPORT";
    static final String CODE_HTTP_STATUS = "LASTFM_HTTP_STATUS";
    static final String CODE_BAD_RESPONSE = "LASTFM_BAD_RESPONSE";
    static final String CODE_API_ERROR = "LASTFM_API_ERROR";

    private final HttpClient httpClient;
    private final LastFmRequestSigner signer;
    private final ObjectMapper objectMapper;

    public LastFmTransport(HttpClient lastFmHttpClient, LastFmRequestSigner signer, ObjectMapper objectMapper) {
        this.httpClient = lastFmHttpClient;
        this.signer = signer;
        this.objectMapper = objectMapper;
    }

    public JsonNode postSigned(Map<String, String> params, String secret) {
        SignedRequest signed = signer.sign(params, secret);
        HttpPost post = new HttpPost(signer.getApiRoot());
        post.setEntity(new StringEntity(signer.buildForm(signed), ContentType.APPLICATION_FORM_URLENCODED));
        return execute(post, params.get("method"));
    }

    public JsonNode get(Map<String, String> params) {
        HttpGet get = new HttpGet(signer.buildUri(signer.unsigned(params)));
        return execute(get, params.get("method"));
    }

    private JsonNode execute(HttpUriRequest request, String method) {
        log.debug("LastFM request, method={}, httpMethod={}", method, request.getMethod());
        HttpResponse response;
        try {
            response = httpClient.execute(request);
        } catch (IOException e) {
            throw new ScrobblerException(ErrorKind.RETRYABLE, CODE_TRANSPORT,
                    "LastFM request failed, method=" + method + ": " + e.getMessage(), e);
        }
        try {
            int status = response.getStatusLine().getStatusCode();
            String body = readBody(response.getEntity(), method);
            log.debug("LastFM response, method={}, status={}, body={}", method, status, body);
            if (status < 200 || status >= 300) {
                throw statusError(method, status, body);
            }
            JsonNode root = parse(body, method);
            if (root.has("error")) {
                throw new ScrobblerException(ErrorKind.REJECTED, CODE_API_ERROR,
                        "LastFM rejected " + method + ": " + errorMessage(root));
            }
            return root;
        } finally {
            closeQuietly(response);
        }
    }

    private ScrobblerException statusError(String method, int status, String body) {
        String detail = "LastFM returned HTTP " + status + " for " + method;
        String apiMessage = apiMessageOrNull(body);
        if (apiMessage != null) {
            detail = detail + ": " + apiMessage;
        }
        if (status >= 500) {
            return new ScrobblerException(ErrorKind.RETRYABLE, CODE_HTTP_STATUS, detail);
        }
        if (status >= 400) {
            return new ScrobblerException(ErrorKind.REJECTED, CODE_HTTP_STATUS, detail);
        }
        return new ScrobblerException(ErrorKind.PROTOCOL, CODE_HTTP_STATUS, detail);
    }

    private String readBody(HttpEntity entity, String method) {
        if (entity == null) {
            return "";
        }
        try {
            return EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScrobblerException(ErrorKind.RETRYABLE, CODE_TRANSPORT,
                    "Reading LastFM response failed, method=" + method + ": " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body, String method) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ScrobblerException(ErrorKind.PROTOCOL, CODE_BAD_RESPONSE,
                        "LastFM response for " + method + " is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ScrobblerException(ErrorKind.PROTOCOL, CODE_BAD_RESPONSE,
                    "LastFM response for " + method + " is not valid JSON", e);
        }
    }

    private String apiMessageOrNull(String body) {
        if (body == null || body.trim().isEmpty()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            return root != null && root.hasNonNull("message") ? errorMessage(root) : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String errorMessage(JsonNode root) {
        return root.path("message").asText("") + " (error " + root.path("error").asText("?") + ")";
    }

    private static void closeQuietly(HttpResponse response) {
        if (response instanceof Closeable) {
            try {
                ((Closeable) response).close();
            } catch (IOException e) {
                log.debug("Closing LastFM response failed", e);
            }
        } else {
            EntityUtils.consumeQuietly(response.getEntity());
        }
    }
}
