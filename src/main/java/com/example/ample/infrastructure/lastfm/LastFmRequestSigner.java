package com.example.ample.infrastructure.lastfm;

import com.example.ample.common.config.AppLastFmProperties;
import com.example.ample.common.util.HashUtil;
import com.example.ample.common.util.PercentEncoder;
import com.example.ample.domain.model.SignedRequest;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes and signs LastFM API parameters.
 * <p>
 * Signature: sort parameters by key (unsigned UTF-8 byte order), concatenate {@code key + value}
 * without separators, append the shared secret, MD5, lowercase hex. {@code format} and
 * {@code api_sig} are never part of the signed string; they are appended when the query or form
 * body is rendered, {@code api_sig} first.
 */
@Component
public class LastFmRequestSigner {

    static final String PARAM_SIGNATURE = "api_sig";
    static final String PARAM_FORMAT = "format";
    static final String FORMAT_JSON = "json";

    static final Comparator<String> UTF8_BYTE_ORDER = LastFmRequestSigner::compareUtf8;

    private final String apiRoot;

    @Autowired
    public LastFmRequestSigner(AppLastFmProperties properties) {
        this(properties.getApiRoot());
    }

    LastFmRequestSigner(String apiRoot) {
        this.apiRoot = apiRoot;
    }

    public SignedRequest sign(Map<String, String> params, String secret) {
        Map<String, String> ordered = canonicalOrder(params);
        return new SignedRequest(ordered, signature(ordered, secret));
    }

    public SignedRequest unsigned(Map<String, String> params) {
        return new SignedRequest(canonicalOrder(params), null);
    }

    public static String signature(Map<String, String> params, String secret) {
        StringBuilder unhashed = new StringBuilder();
        for (Map.Entry<String, String> entry : canonicalOrder(params).entrySet()) {
            unhashed.append(entry.getKey()).append(entry.getValue());
        }
        unhashed.append(secret);
        return HashUtil.md5Hex(unhashed.toString());
    }

    public String buildQuery(SignedRequest request) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : request.getParams().entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(PercentEncoder.encode(entry.getKey()))
                    .append('=')
                    .append(PercentEncoder.encode(entry.getValue()));
        }
        if (request.isSigned()) {
            appendPair(sb, PARAM_SIGNATURE, request.getSignature());
        }
        appendPair(sb, PARAM_FORMAT, FORMAT_JSON);
        return sb.toString();
    }

    public String buildUri(SignedRequest request) {
        return apiRoot + "?" + buildQuery(request);
    }

    public String buildForm(SignedRequest request) {
        return buildQuery(request);
    }

    public String getApiRoot() {
        return apiRoot;
    }

    private static void appendPair(StringBuilder sb, String key, String value) {
        if (sb.length() > 0) {
            sb.append('&');
        }
        sb.append(key).append('=').append(PercentEncoder.encode(value));
    }

    private static Map<String, String> canonicalOrder(Map<String, String> params) {
        TreeMap<String, String> sorted = new TreeMap<>(UTF8_BYTE_ORDER);
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            if (PARAM_SIGNATURE.equals(entry.getKey()) || PARAM_FORMAT.equals(entry.getKey())) {
                continue;
            }
            sorted.put(entry.getKey(), entry.getValue());
        }
        return new LinkedHashMap<>(sorted);
    }

    private static int compareUtf8(String a, String b) {
        byte[] left = a.getBytes(StandardCharsets.UTF_8);
        byte[] right = b.getBytes(StandardCharsets.UTF_8);
        int len = Math.min(left.length, right.length);
        for (int i = 0; i < len; i++) {
            int cmp = (left[i] & 0xff) - (right[i] & 0xff);
            if (cmp != 0) {
                return cmp;
            }
        }
        return left.length - right.length;
    }
}
