package com.example.checkin.controller;

import com.example.checkin.entities.CheckInSession;
import com.example.checkin.entities.Semester;
import com.example.checkin.service.access.AppUserService;
import com.example.checkin.service.access.CallerIdentity;
import com.example.checkin.service.access.ClassAccessPolicy;
import com.example.checkin.service.analytics.AttendanceReconciler;
import com.example.checkin.service.analytics.ClassAttendanceOverview;
import com.example.checkin.service.analytics.StudentClassDetail;
import com.example.checkin.service.calendar.SemesterService;
import com.example.checkin.service.checkin.CheckInError;
import com.example.checkin.service.checkin.CheckInErrorCode;
import com.example.checkin.service.checkin.CheckInProcessor;
import com.example.checkin.service.checkin.CheckInResult;
import com.example.checkin.service.geo.GeoLocation;
import com.example.checkin.service.schedule.WeekSchedule;
import com.example.checkin.service.schedule.WeekScheduleService;
import com.example.checkin.service.session.SessionLifecycleManager;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
@RequestMapping("/student")
public class StudentController {

    private final Logger log = LoggerFactory.getLogger(StudentController.class);

    private final SessionLifecycleManager lifecycleManager;
    private final CheckInProcessor checkInProcessor;
    private final AttendanceReconciler reconciler;
    private final SemesterService semesterService;
    private final ClassAccessPolicy accessPolicy;
    private final AppUserService appUserService;
    private final WeekScheduleService scheduleService;

    @GetMapping("/sessions/active")
    public ResponseEntity<Map<String, Object>> activeSessions(Authentication authentication) {
        CallerIdentity caller = appUserService.identify(authentication);
        List<Map<String, Object>> sessions = lifecycleManager.findActiveSessionsForStudent(caller.getSubjectId())
                .stream()
                .map(s -> SessionViews.session(s, lifecycleManager.stateOf(s)))
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("success", true, "sessions", sessions));
    }

    /**
     * Body: {"sessionId": 1, "latitude": 3.139, "longitude": 101.6869, "accuracy": 12.5}
     * Location is ignored for online sessions.
     */
    @PostMapping("/checkin")
    public ResponseEntity<Map<String, Object>> checkIn(@RequestBody Map<String, Object> payload,
                                                       Authentication authentication) {
        CallerIdentity caller = appUserService.identify(authentication);
        Long sessionId = RequestValues.asLong(payload.get("sessionId"));
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId is required");
        }

        CheckInSession session = lifecycleManager.requireSession(sessionId);
        if (!accessPolicy.canAttend(caller, session.getClassId())) {
            return ApiErrors.checkInFailure(CheckInError.of(CheckInErrorCode.STUDENT_NOT_ENROLLED,
                    "You are not enrolled in this class"));
        }

        GeoLocation location = new GeoLocation(RequestValues.asDouble(payload.get("latitude")),
                RequestValues.asDouble(payload.get("longitude")), RequestValues.asDouble(payload.get("accuracy")));
        CheckInResult result = checkInProcessor.submitCheckIn(sessionId, caller.getSubjectId(), location);
        if (!result.isSuccess()) {
            log.info("Check-in refused for student {} session {}: {}", caller.getSubjectId(), sessionId,
                    result.getError().getCode());
            return ApiErrors.checkInFailure(result.getError());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("message", "Check-in successful!");
        body.put("data", SessionViews.checkIn(result.getCheckIn()));
        return ResponseEntity.ok(body);
    }

    /**
     * ?week=1..14, ?week=break, or no parameter for the current week.
     */
    @GetMapping("/schedule")
    public ResponseEntity<Map<String, Object>> schedule(@RequestParam(required = false) String week,
                                                        Authentication authentication) {
        CallerIdentity caller = appUserService.identify(authentication);
        Semester semester = semesterService.getActiveSemester();
        WeekSchedule schedule = scheduleService.forStudent(caller.getSubjectId(), semester, week);
        return ResponseEntity.ok(Map.of("success", true, "semester", semesterService.describe(semester),
                "schedule", schedule));
    }

    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> overview(Authentication authentication) {
        CallerIdentity caller = appUserService.identify(authentication);
        Semester semester = semesterService.getActiveSemester();
        List<ClassAttendanceOverview> classes = reconciler.studentOverview(caller.getSubjectId(), semester);
        return ResponseEntity.ok(Map.of("success", true, "semester", semesterService.describe(semester), "classes", classes));
    }

    @GetMapping("/analytics/classes/{classId}")
    public ResponseEntity<Map<String, Object>> classDetail(@PathVariable Long classId, Authentication authentication) {
        CallerIdentity caller = appUserService.identify(authentication);
        if (!accessPolicy.canAttend(caller, classId)) {
            throw new AccessDeniedException("Not enrolled in class " + classId);
        }
        Semester semester = semesterService.getActiveSemester();
        StudentClassDetail detail = reconciler.studentClassDetail(caller.getSubjectId(), classId, semester);
        return ResponseEntity.ok(Map.of("success", true, "semester", semesterService.describe(semester), "detail", detail));
    }
}
