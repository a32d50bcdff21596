package com.williamcallahan.agentknowledge.support;

import com.williamcallahan.agentknowledge.store.KnowledgeStoreException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Locale;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Decides whether a failure is worth retrying.
 *
 * <p>Only infrastructure hiccups qualify: connection loss, timeouts, lock contention, and
 * serialization failures. Constraint violations, bad SQL, and validation errors never do.</p>
 */
public final class TransientFailureClassifier {

    /** PostgreSQL SQLSTATE class for connection exceptions. */
    private static final String SQLSTATE_CONNECTION_CLASS = "08";
    /** PostgreSQL serialization_failure. */
    private static final String SQLSTATE_SERIALIZATION_FAILURE = "40001";
    /** PostgreSQL deadlock_detected. */
    private static final String SQLSTATE_DEADLOCK = "40P01";
    /** PostgreSQL admin_shutdown / crash_shutdown / cannot_connect_now. */
    private static final String SQLSTATE_OPERATOR_INTERVENTION_CLASS = "57P";

    private TransientFailureClassifier() {}

    /**
     * Walks the cause chain looking for a transient failure marker.
     *
     * @param error failure to classify
     * @return true when retrying the same operation may succeed
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof KnowledgeStoreException storeException) {
                return storeException.isTransient();
            }
            if (current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException
                    || current instanceof ConnectException
                    || current instanceof SocketTimeoutException) {
                return true;
            }
            if (current instanceof java.sql.SQLException sqlException && isTransientSqlState(sqlException)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isTransientSqlState(java.sql.SQLException sqlException) {
        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return false;
        }
        String normalized = sqlState.toUpperCase(Locale.ROOT);
        return normalized.startsWith(SQLSTATE_CONNECTION_CLASS)
                || normalized.startsWith(SQLSTATE_OPERATOR_INTERVENTION_CLASS)
                || SQLSTATE_SERIALIZATION_FAILURE.equals(normalized)
                || SQLSTATE_DEADLOCK.equals(normalized);
    }
}
