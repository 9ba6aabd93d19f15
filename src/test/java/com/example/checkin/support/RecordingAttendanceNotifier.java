package com.example.checkin.support;

import com.example.checkin.service.notify.AttendanceEvent;
import com.example.checkin.service.notify.AttendanceEventType;
import com.example.checkin.service.notify.AttendanceNotifier;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test notifier that records events for assertions.
 */
public final class RecordingAttendanceNotifier implements AttendanceNotifier {

    private final List<AttendanceEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(AttendanceEvent event) {
        events.add(event);
    }

    public synchronized List<AttendanceEvent> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<AttendanceEvent> ofType(AttendanceEventType type) {
        return events.stream()
                .filter(e -> e.getType() == type)
                .collect(Collectors.toList());
    }

    public synchronized void clear() {
        events.clear();
    }
}
