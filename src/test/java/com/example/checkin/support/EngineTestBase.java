package com.example.checkin.support;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Full application context on H2 with a controllable clock and a recording notifier.
 * Not transactional: the engine relies on each store call committing on its own.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestClockConfig.class, AttendanceFixtures.class})
public abstract class EngineTestBase {

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected RecordingAttendanceNotifier notifier;

    @Autowired
    protected AttendanceFixtures fixtures;

    @BeforeEach
    void resetEngineState() {
        fixtures.clear();
        clock.setInstant(TestClockConfig.DEFAULT_NOW);
        notifier.clear();
    }
}
