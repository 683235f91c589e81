package com.example.ample.infrastructure.lastfm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.apache.http.HttpResponse;
import org.apache.http.HttpVersion;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.message.BasicStatusLine;
import org.apache.http.util.EntityUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LastFmTransportTest {

    private static final String ROOT = "https://ws.audioscrobbler.com/2.0/";

    private HttpClient httpClient;
    private LastFmTransport transport;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        transport = new LastFmTransport(httpClient, new LastFmRequestSigner(ROOT), new ObjectMapper());
    }

    @Test
    void postSignedShouldSendFormBodyToApiRoot() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(200, "{\"nowplaying\":{}}"));

        JsonNode root = transport.postSigned(params("track.updateNowPlaying"), "secret");

        ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);
        verify(httpClient).execute(captor.capture());
        HttpPost post = (HttpPost) captor.getValue();
        assertEquals(ROOT, post.getURI().toString());
        assertTrue(post.getEntity().getContentType().getValue().startsWith("application/x-www-form-urlencoded"));
        String body = EntityUtils.toString(post.getEntity(), StandardCharsets.UTF_8);
        assertTrue(body.startsWith("api_key=k&method=track.updateNowPlaying&api_sig="));
        assertTrue(body.endsWith("&format=json"));
        assertTrue(root.has("nowplaying"));
    }

    @Test
    void getShouldSendUnsignedQuery() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(200, "{\"track\":{}}"));

        transport.get(params("track.getInfo"));

        ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);
        verify(httpClient).execute(captor.capture());
        HttpGet get = (HttpGet) captor.getValue();
        assertEquals(ROOT + "?api_key=k&method=track.getInfo&format=json", get.getURI().toString());
    }

    @Test
    void ioFailureShouldBeRetryable() throws Exception {
        IOException cause = new SocketTimeoutException("read timed out");
        when(httpClient.execute(any(HttpUriRequest.class))).thenThrow(cause);

        ScrobblerException ex = assertThrows(ScrobblerException.class,
                () -> transport.postSigned(params("track.scrobble"), "secret"));

        assertEquals(ErrorKind.RETRYABLE, ex.getKind());
        assertEquals(LastFmTransport.CODE_TRANSPORT, ex.getCode());
        assertSame(cause, ex.getCause());
    }

    @Test
    void serverErrorShouldBeRetryable() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(503, "Service Unavailable"));

        ScrobblerException ex = assertThrows(ScrobblerException.class,
                () -> transport.postSigned(params("track.scrobble"), "secret"));

        assertEquals(ErrorKind.RETRYABLE, ex.getKind());
        assertEquals(LastFmTransport.CODE_HTTP_STATUS, ex.getCode());
    }

    @Test
    void clientErrorShouldBeRejectedEvenWithValidBody() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class)))
                .thenReturn(response(403, "{\"error\":9,\"message\":\"Invalid session key\"}"));

        ScrobblerException ex = assertThrows(ScrobblerException.class,
                () -> transport.postSigned(params("track.scrobble"), "secret"));

        assertEquals(ErrorKind.REJECTED, ex.getKind());
        assertTrue(ex.getMessage().contains("Invalid session key (error 9)"));
    }

    @Test
    void redirectStatusShouldBeProtocolError() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(302, ""));

        ScrobblerException ex = assertThrows(ScrobblerException.class,
                () -> transport.get(params("track.getInfo")));

        assertEquals(ErrorKind.PROTOCOL, ex.getKind());
    }

    @Test
    void malformedBodyShouldBeProtocolError() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(200, "<html>oops</html>"));

        ScrobblerException ex = assertThrows(ScrobblerException.class,
                () -> transport.get(params("track.getInfo")));

        assertEquals(ErrorKind.PROTOCOL, ex.getKind());
        assertEquals(LastFmTransport.CODE_BAD_RESPONSE, ex.getCode());
    }

    @Test
    void errorBodyWithSuccessStatusShouldBeRejected() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class)))
                .thenReturn(response(200, "{\"error\":6,\"message\":\"Track not found\"}"));

        ScrobblerException ex = assertThrows(ScrobblerException.class,
                () -> transport.get(params("track.getInfo")));

        assertEquals(ErrorKind.REJECTED, ex.getKind());
        assertEquals(LastFmTransport.CODE_API_ERROR, ex.getCode());
    }

    private static Map<String, String> params(String method) {
        Map<String, String> params = new HashMap<>();
        params.put("method", method);
        params.put("api_key", "k");
        return params;
    }

    static HttpResponse response(int status, String body) {
        BasicHttpResponse response = new BasicHttpResponse(new BasicStatusLine(HttpVersion.HTTP_1_1, status, "status"));
        response.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));
        return response;
    }
}
