package com.example.checkin.service.notify;

/**
 * Best-effort push of lifecycle and check-in events. Implementations return immediately and never
 * throw: a client that misses an event re-queries current state.
 */
public interface AttendanceNotifier {

    void publish(AttendanceEvent event);
}
