package com.example.checkin.controller;

import com.example.checkin.entities.CheckInSession;
import com.example.checkin.entities.Semester;
import com.example.checkin.service.access.AppUserService;
import com.example.checkin.service.access.CallerIdentity;
import com.example.checkin.service.access.ClassAccessPolicy;
import com.example.checkin.service.analytics.AttendanceCsvExporter;
import com.example.checkin.service.analytics.AttendanceReconciler;
import com.example.checkin.service.analytics.ClassAttendanceOverview;
import com.example.checkin.service.analytics.ClassAttendanceReport;
import com.example.checkin.service.analytics.ClassSessionDetail;
import com.example.checkin.service.calendar.SemesterService;
import com.example.checkin.service.checkin.CheckInProcessor;
import com.example.checkin.service.checkin.CheckInResult;
import com.example.checkin.service.error.StoreFailures;
import com.example.checkin.service.schedule.WeekSchedule;
import com.example.checkin.service.schedule.WeekScheduleService;
import com.example.checkin.service.session.OpenedSession;
import com.example.checkin.service.session.SessionLifecycleManager;
import com.example.checkin.service.session.SessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Lecturer endpoints: open check-in windows, watch them fill, override, and read class analytics.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/lecturer")
public class LecturerController {

    private final SessionLifecycleManager lifecycleManager;
    private final SessionStore sessionStore;
    private final CheckInProcessor checkInProcessor;
    private final AttendanceReconciler reconciler;
    private final AttendanceCsvExporter csvExporter;
    private final SemesterService semesterService;
    private final ClassAccessPolicy accessPolicy;
    private final AppUserService appUserService;
    private final WeekScheduleService scheduleService;

    /**
     * Open (or re-open) this week's check-in for the class.
     * Body: {"onlineMode": true|false}. 201 when a session was created, 200 when one was already active.
     */
    @PostMapping("/classes/{classId}/sessions")
    public ResponseEntity<Map<String, Object>> openSession(@PathVariable Long classId,
                                                           @RequestBody(required = false) Map<String, Object> payload,
                                                           Authentication authentication) {
        requireManage(authentication, classId);
        boolean onlineMode = payload != null && Boolean.TRUE.equals(payload.get("onlineMode"));

        Semester semester = semesterService.getActiveSemester();
        OpenedSession opened = lifecycleManager.openSessionForToday(classId, semester, onlineMode);

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("created", opened.isCreated());
        body.put("message", opened.isCreated() ? "Check-in activated" : "An active check-in already exists");
        body.put("session", SessionViews.session(opened.getSession(), lifecycleManager.stateOf(opened.getSession())));
        return ResponseEntity.status(opened.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @GetMapping("/classes/{classId}/sessions/active")
    public ResponseEntity<Map<String, Object>> activeSession(@PathVariable Long classId, Authentication authentication) {
        requireManage(authentication, classId);
        List<CheckInSession> active = lifecycleManager.findActiveSessions(classId);

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        if (active.isEmpty()) {
            body.put("session", null);
            body.put("checkins", List.of());
            return ResponseEntity.ok(body);
        }
        CheckInSession session = active.get(0);
        body.put("session", SessionViews.session(session, lifecycleManager.stateOf(session)));
        body.put("checkins", sessionStore.findCheckIns(session.getId()).stream()
                .map(SessionViews::checkIn)
                .collect(Collectors.toList()));
        return ResponseEntity.ok(body);
    }

    /**
     * Body: {"studentId": 42}
     */
    @PostMapping("/sessions/{sessionId}/manual-checkin")
    public ResponseEntity<Map<String, Object>> manualCheckIn(@PathVariable Long sessionId,
                                                             @RequestBody Map<String, Object> payload,
                                                             Authentication authentication) {
        Long studentId = payload == null ? null : RequestValues.asLong(payload.get("studentId"));
        if (studentId == null) {
            throw new IllegalArgumentException("studentId is required");
        }
        // ownership first: an unknown session and someone else's session both answer 403
        Long classId = StoreFailures.guard("load session", () -> sessionStore.findSession(sessionId))
                .map(CheckInSession::getClassId)
                .orElse(null);
        requireManage(authentication, classId);
        lifecycleManager.requireSession(sessionId);

        CheckInResult result = checkInProcessor.recordManualCheckIn(sessionId, studentId);
        if (!result.isSuccess()) {
            return ApiErrors.checkInFailure(result.getError());
        }
        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("message", "Manual check-in successful");
        body.put("data", SessionViews.checkIn(result.getCheckIn()));
        return ResponseEntity.ok(body);
    }

    /**
     * Roster with each student's status for the class meeting on ?date=YYYY-MM-DD, or for the most
     * recent session when no date is given.
     */
    @GetMapping("/classes/{classId}/details")
    public ResponseEntity<Map<String, Object>> classDetail(@PathVariable Long classId,
                                                           @RequestParam(required = false)
                                                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                                           Authentication authentication) {
        requireManage(authentication, classId);
        ClassSessionDetail detail = reconciler.classDetail(classId, date, semesterService.getActiveSemester());
        return ResponseEntity.ok(Map.of("success", true, "detail", detail));
    }

    /**
     * ?week=1..14, ?week=break, or no parameter for the current week.
     */
    @GetMapping("/schedule")
    public ResponseEntity<Map<String, Object>> schedule(@RequestParam(required = false) String week,
                                                        Authentication authentication) {
        CallerIdentity caller = appUserService.identify(authentication);
        Semester semester = semesterService.getActiveSemester();
        WeekSchedule schedule = scheduleService.forLecturer(caller.getSubjectId(), semester, week);
        return ResponseEntity.ok(Map.of("success", true, "semester", semesterService.describe(semester),
                "schedule", schedule));
    }

    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> overview(Authentication authentication) {
        CallerIdentity caller = appUserService.identify(authentication);
        Semester semester = semesterService.getActiveSemester();
        List<ClassAttendanceOverview> classes = reconciler.lecturerOverview(caller.getSubjectId(), semester);
        return ResponseEntity.ok(Map.of("success", true, "semester", semesterService.describe(semester), "classes", classes));
    }

    @GetMapping("/analytics/classes/{classId}")
    public ResponseEntity<Map<String, Object>> classAnalytics(@PathVariable Long classId, Authentication authentication) {
        requireManage(authentication, classId);
        Semester semester = semesterService.getActiveSemester();
        ClassAttendanceReport report = reconciler.classReport(classId, semester);
        return ResponseEntity.ok(Map.of("success", true, "semester", semesterService.describe(semester), "report", report));
    }

    /**
     * ?type=students (default) or ?type=sessions
     */
    @GetMapping(value = "/analytics/classes/{classId}/export.csv", produces = "text/csv")
    public ResponseEntity<String> exportCsv(@PathVariable Long classId,
                                            @RequestParam(defaultValue = "students") String type,
                                            Authentication authentication) {
        requireManage(authentication, classId);
        ClassAttendanceReport report = reconciler.classReport(classId, semesterService.getActiveSemester());
        String csv = "sessions".equalsIgnoreCase(type) ? csvExporter.sessionsCsv(report) : csvExporter.studentsCsv(report);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("text/csv"))
                .header("Content-Disposition", "attachment; filename=\"class-" + classId + "-" + type + ".csv\"")
                .body(csv);
    }

    private void requireManage(Authentication authentication, Long classId) {
        CallerIdentity caller = appUserService.identify(authentication);
        if (!accessPolicy.canManage(caller, classId)) {
            throw new AccessDeniedException("Not your class: " + classId);
        }
    }
}
