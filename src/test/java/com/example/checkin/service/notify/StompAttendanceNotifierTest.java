package com.example.checkin.service.notify;

import com.example.checkin.entities.CheckInSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StompAttendanceNotifierTest {

    private static final CheckInSession SESSION = CheckInSession.builder()
            .id(5L)
            .classId(12L)
            .startedAt(Instant.parse("2025-02-17T09:00:00Z"))
            .expiresAt(Instant.parse("2025-02-17T09:02:00Z"))
            .onlineMode(false)
            .build();

    @Test
    void publishesToTheClassTopic() {
        SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
        AttendanceEvent event = AttendanceEvent.sessionOpened(SESSION);

        new StompAttendanceNotifier(template).publish(event);

        verify(template).convertAndSend(eq("/topic/class.12"), eq((Object) event));
    }

    @Test
    void brokerFailureIsNotPropagated() {
        SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
        doThrow(new MessageDeliveryException("broker down"))
                .when(template).convertAndSend(any(String.class), any(Object.class));

        assertDoesNotThrow(() -> new StompAttendanceNotifier(template).publish(AttendanceEvent.sessionExpired(SESSION)));
    }

    @Test
    void eventJsonUsesWireNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

        JsonNode opened = mapper.readTree(mapper.writeValueAsString(AttendanceEvent.sessionOpened(SESSION)));
        assertEquals("session_opened", opened.get("type").asText());
        assertEquals(12, opened.get("class_id").asLong());
        assertEquals(5, opened.get("session_id").asLong());
        assertFalse(opened.get("online_mode").asBoolean());
        assertFalse(opened.has("student_id"));

        JsonNode expired = mapper.readTree(mapper.writeValueAsString(AttendanceEvent.sessionExpired(SESSION)));
        assertEquals("session_expired", expired.get("type").asText());
        assertFalse(expired.has("expires_at"));
    }
}
