package com.example.checkin.service.error;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

import static org.junit.jupiter.api.Assertions.*;

class StoreFailuresTest {

    @Test
    void transientFailuresBecomeRetryable() {
        AttendanceException ex = assertThrows(AttendanceException.class, () -> StoreFailures.guard("load session", () -> {
            throw new QueryTimeoutException("slow");
        }));
        assertEquals(ErrorKind.TRANSIENT, ex.getKind());
        assertTrue(ex.getKind().isRetryable());
        assertInstanceOf(QueryTimeoutException.class, ex.getCause());

        assertTrue(StoreFailures.isTransient(new CannotCreateTransactionException("no connection")));
    }

    @Test
    void constraintViolationsPassThrough() {
        assertThrows(DataIntegrityViolationException.class, () -> StoreFailures.guard("save check-in", () -> {
            throw new DataIntegrityViolationException("duplicate");
        }));
        assertFalse(StoreFailures.isTransient(new DataIntegrityViolationException("duplicate")));
    }

    @Test
    void returnsTheValueWhenTheCallSucceeds() {
        assertEquals("ok", StoreFailures.guard("noop", () -> "ok"));
    }
}
