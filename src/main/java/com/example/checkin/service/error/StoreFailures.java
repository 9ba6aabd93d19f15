package com.example.checkin.service.error;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.util.function.Supplier;

/**
 * Classifies exceptions coming out of the store.
 */
public final class StoreFailures {

    private StoreFailures() {
    }

    /** Store down, timed out or lost a lock race: the whole operation may be retried. */
    public static boolean isTransient(Throwable ex) {
        return ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException
                || ex instanceof CannotCreateTransactionException
                || ex instanceof TransactionTimedOutException;
    }

    /**
     * Runs a store call, turning transient store failures into a retryable {@link AttendanceException}.
     * Everything else, constraint violations included, propagates unchanged.
     */
    public static <T> T guard(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException ex) {
            if (isTransient(ex)) {
                throw AttendanceException.storeUnavailable(operation, ex);
            }
            throw ex;
        }
    }
}
