package com.example.ample.infrastructure.lastfm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LastFmSessionClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LastFmTransport transport = mock(LastFmTransport.class);
    private final LastFmSessionClient sessionClient = new LastFmSessionClient(transport);

    @Test
    void requestMobileSessionShouldReturnSessionKey() throws Exception {
        when(transport.postSigned(anyMap(), eq("apiSecret")))
                .thenReturn(objectMapper.readTree("{\"session\":{\"name\":\"alice\",\"key\":\"sk-123\"}}"));

        String key = sessionClient.requestMobileSession("apiKey", "apiSecret", "alice", "pw");

        assertEquals("sk-123", key);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(transport).postSigned(captor.capture(), eq("apiSecret"));
        assertEquals("auth.getMobileSession", captor.getValue().get("method"));
        assertEquals("alice", captor.getValue().get("username"));
        assertEquals("pw", captor.getValue().get("password"));
        assertEquals("apiKey", captor.getValue().get("api_key"));
    }

    @Test
    void requestMobileSessionShouldRejectResponseWithoutKey() throws Exception {
        when(transport.postSigned(anyMap(), eq("apiSecret"))).thenReturn(objectMapper.readTree("{\"session\":{}}"));

        ScrobblerException ex = assertThrows(ScrobblerException.class,
                () -> sessionClient.requestMobileSession("apiKey", "apiSecret", "alice", "pw"));

        assertEquals(ErrorKind.PROTOCOL, ex.getKind());
    }
}
