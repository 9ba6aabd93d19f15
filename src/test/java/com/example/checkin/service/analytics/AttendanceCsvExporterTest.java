package com.example.checkin.service.analytics;

import com.example.checkin.service.session.SessionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AttendanceCsvExporterTest {

    private final AttendanceCsvExporter exporter = new AttendanceCsvExporter();

    @Test
    void escapesCommasAndQuotes() {
        assertEquals("plain", AttendanceCsvExporter.escape("plain"));
        assertEquals("\"Lee, Ana\"", AttendanceCsvExporter.escape("Lee, Ana"));
        assertEquals("\"say \"\"hi\"\"\"", AttendanceCsvExporter.escape("say \"hi\""));
    }

    @Test
    void quotesValuesWithLineBreaks() {
        assertEquals("\"two\nlines\"", AttendanceCsvExporter.escape("two\nlines"));
        assertEquals("\"old\rmac\"", AttendanceCsvExporter.escape("old\rmac"));
        assertEquals("\"dos\r\nstyle\"", AttendanceCsvExporter.escape("dos\r\nstyle"));
    }

    @Test
    void rendersOneRowPerStudentAndSession() {
        StudentAttendance ana = new StudentAttendance(7L, "Lee, Ana", null, AttendanceSummary.of(1, 1, 0));
        SessionAttendance session = new SessionAttendance(3L, LocalDate.of(2025, 2, 17),
                Instant.parse("2025-02-17T09:00:00Z"), false, SessionState.EXPIRED, 1, 0, 0, 100);
        ClassAttendanceReport report = new ClassAttendanceReport(1L, "Algorithms", "CS101", 1,
                AttendanceSummary.of(1, 1, 0), List.of(ana), List.of(session), List.of(ana));

        String[] students = exporter.studentsCsv(report).split("\n");
        assertEquals(2, students.length);
        assertTrue(students[0].startsWith("student_id,name,email"));
        assertEquals("7,\"Lee, Ana\",,1,1,0,50,critical", students[1]);

        String[] sessions = exporter.sessionsCsv(report).split("\n");
        assertEquals("3,2025-02-17,2025-02-17T09:00:00Z,1,0,0,100", sessions[1]);
    }
}
