package com.example.checkin.service.analytics;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * CSV renderings of a class report.
 */
@Component
public class AttendanceCsvExporter {

    public String studentsCsv(ClassAttendanceReport report) {
        StringBuilder csv = new StringBuilder("student_id,name,email,present_count,missed_count,pending_count,attendance_rate,status\n");
        for (StudentAttendance st : report.getStudents()) {
            AttendanceSummary s = st.getSummary();
            row(csv, List.of(String.valueOf(st.getStudentId()), nullToEmpty(st.getName()), nullToEmpty(st.getEmail()),
                    String.valueOf(s.getPresent()), String.valueOf(s.getMissed()), String.valueOf(s.getPending()),
                    String.valueOf(s.getRate()), s.getTier().name().toLowerCase()));
        }
        return csv.toString();
    }

    public String sessionsCsv(ClassAttendanceReport report) {
        StringBuilder csv = new StringBuilder("session_id,date,started_at,present_count,missed_count,pending_count,attendance_rate\n");
        for (SessionAttendance s : report.getSessions()) {
            row(csv, List.of(String.valueOf(s.getSessionId()), String.valueOf(s.getOccurrenceDate()),
                    String.valueOf(s.getStartedAt()), String.valueOf(s.getPresent()), String.valueOf(s.getMissed()),
                    String.valueOf(s.getPending()), String.valueOf(s.getRate())));
        }
        return csv.toString();
    }

    private static void row(StringBuilder csv, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) csv.append(',');
            csv.append(escape(cells.get(i)));
        }
        csv.append('\n');
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
