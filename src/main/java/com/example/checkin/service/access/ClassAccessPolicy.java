package com.example.checkin.service.access;

/**
 * Class-level authorization decisions.
 */
public interface ClassAccessPolicy {

    /** May open sessions, record manual check-ins and read class analytics. */
    boolean canManage(CallerIdentity caller, Long classId);

    /** May check in to and read own attendance for the class. */
    boolean canAttend(CallerIdentity caller, Long classId);
}
