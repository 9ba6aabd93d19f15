package com.example.checkin.service.session;

import com.example.checkin.entities.CheckInSession;
import lombok.Value;

/**
 * Result of an open request: the active session for the occurrence and whether this request created it.
 */
@Value
public class OpenedSession {
    CheckInSession session;
    boolean created;
}
