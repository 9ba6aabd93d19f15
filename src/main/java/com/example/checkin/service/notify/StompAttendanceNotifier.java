package com.example.checkin.service.notify;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes events to the STOMP topic of the event's class. Students of the class and the lecturer
 * view subscribe to the same topic.
 */
@Component
@RequiredArgsConstructor
public class StompAttendanceNotifier implements AttendanceNotifier {

    private static final Logger log = LoggerFactory.getLogger(StompAttendanceNotifier.class);

    public static final String CLASS_TOPIC_PREFIX = "/topic/class.";

    private final SimpMessagingTemplate messagingTemplate;

    public static String topicFor(Long classId) {
        return CLASS_TOPIC_PREFIX + classId;
    }

    @Override
    public void publish(AttendanceEvent event) {
        String destination = topicFor(event.getClassId());
        try {
            messagingTemplate.convertAndSend(destination, event);
            log.debug("Published {} to {} session={}", event.getType().wireName(), destination, event.getSessionId());
        } catch (MessagingException ex) {
            // delivery is at-most-once; state stays queryable
            log.warn("Failed to publish {} to {}: {}", event.getType().wireName(), destination, ex.getMessage());
        }
    }
}
