package com.example.checkin.service.analytics;

import lombok.Value;

import java.util.List;

@Value
public class StudentClassDetail {
    Long classId;
    String className;
    String courseCode;
    String lecturerName;
    AttendanceSummary summary;
    List<SessionStatusEntry> sessions;
    Insights insights;

    /**
     * Projection against the planned number of teaching weeks (one session per week).
     */
    @Value
    public static class Insights {
        int remainingSessions;
        int projectedRateIfAllAttended;
        boolean atRisk;
        boolean warning;

        static Insights of(AttendanceSummary summary, int plannedSessions) {
            int remaining = Math.max(0, plannedSessions - summary.getTotal());
            int credited = summary.getTotal() - summary.getMissed() + remaining;
            int projected = AttendanceSummary.rateOf(credited, summary.getTotal() + remaining);
            return new Insights(remaining, projected, summary.getRate() < 80,
                    summary.getRate() >= 80 && summary.getRate() < 90);
        }
    }
}
