package com.example.checkin.service.analytics;

import com.example.checkin.enums.AttendanceTier;
import lombok.Value;

/**
 * Counts over a set of (student, session) pairs.
 *
 * total counts every session row created in range. Pending sessions are not penalised:
 * rate = round((total - missed) / max(total, 1) * 100).
 */
@Value
public class AttendanceSummary {
    int total;
    int present;
    int missed;
    int pending;
    int rate;
    AttendanceTier tier;

    public static AttendanceSummary of(int present, int missed, int pending) {
        int total = present + missed + pending;
        int rate = rateOf(total - missed, total);
        return new AttendanceSummary(total, present, missed, pending, rate, AttendanceTier.forRate(rate));
    }

    static int rateOf(int credited, int total) {
        return (int) Math.round(credited * 100.0 / Math.max(total, 1));
    }

    public AttendanceSummary plus(AttendanceSummary other) {
        return of(present + other.present, missed + other.missed, pending + other.pending);
    }

    public static AttendanceSummary empty() {
        return of(0, 0, 0);
    }
}
