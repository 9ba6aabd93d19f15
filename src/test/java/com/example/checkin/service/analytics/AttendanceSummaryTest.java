package com.example.checkin.service.analytics;

import com.example.checkin.enums.AttendanceTier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttendanceSummaryTest {

    @Test
    void pendingSessionsAreNotPenalised() {
        AttendanceSummary s = AttendanceSummary.of(1, 1, 1);
        assertEquals(3, s.getTotal());
        assertEquals(67, s.getRate());
        assertEquals(AttendanceTier.CRITICAL, s.getTier());
    }

    @Test
    void emptySummaryHasZeroRate() {
        AttendanceSummary s = AttendanceSummary.empty();
        assertEquals(0, s.getTotal());
        assertEquals(0, s.getRate());
        assertEquals(AttendanceTier.CRITICAL, s.getTier());
    }

    @Test
    void allPresentIsGood() {
        AttendanceSummary s = AttendanceSummary.of(10, 0, 0);
        assertEquals(100, s.getRate());
        assertEquals(AttendanceTier.GOOD, s.getTier());
    }

    @Test
    void oneMissOutOfTenIsStillGood() {
        assertEquals(AttendanceTier.GOOD, AttendanceSummary.of(9, 1, 0).getTier());
        assertEquals(AttendanceTier.WARNING, AttendanceSummary.of(8, 2, 0).getTier());
    }

    @Test
    void plusAddsCountsAndRecomputesRate() {
        AttendanceSummary sum = AttendanceSummary.of(2, 0, 0).plus(AttendanceSummary.of(0, 2, 0));
        assertEquals(4, sum.getTotal());
        assertEquals(2, sum.getPresent());
        assertEquals(2, sum.getMissed());
        assertEquals(50, sum.getRate());
    }

    @Test
    void insightsProjectRemainingWeeks() {
        StudentClassDetail.Insights insights = StudentClassDetail.Insights.of(AttendanceSummary.of(3, 1, 0), 14);
        assertEquals(10, insights.getRemainingSessions());
        // 13 of 14 credited if every remaining session is attended
        assertEquals(93, insights.getProjectedRateIfAllAttended());
        assertTrue(insights.isAtRisk());
        assertFalse(insights.isWarning());
    }
}
