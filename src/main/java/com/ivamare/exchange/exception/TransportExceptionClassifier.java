package com.ivamare.exchange.exception;

import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.AmqpTimeoutException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.io.IOException;
import java.net.ConnectException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classifies transport exceptions raised while delivering output.
 *
 * <p>A <em>service error</em> means the messaging service itself is unavailable
 * or overloaded: broker connection failures, database connection loss,
 * resource exhaustion, shutdowns. Those are retried with a longer base delay
 * than ordinary send failures.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class TransportExceptionClassifier {

    private TransportExceptionClassifier() {
        // Utility class - no instantiation
    }

    /**
     * SQL states reported by the queue database when the service is unavailable.
     */
    private static final Set<String> SERVICE_SQL_STATES = Set.of(
        // Class 08 - Connection Exception
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        // Class 53 - Insufficient Resources
        "53000", "53100", "53200", "53300",
        // Class 57 - Operator Intervention
        "57P01", "57P02", "57P03"
    );

    /**
     * SQL state for "relation does not exist", raised by PGMQ for unknown queues.
     */
    public static final String UNDEFINED_TABLE_SQL_STATE = "42P01";

    private static final String[] SERVICE_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "connect timed out",
        "service unavailable",
        "server busy",
        "throttl",
        "broker not available",
        "no route to host",
        "network is unreachable",
        "the database system is shutting down",
        "the database system is starting up"
    };

    /**
     * Determine if the exception indicates the messaging service is unavailable.
     *
     * @param ex the exception to classify
     * @return true for service-level failures
     */
    public static boolean isServiceError(Throwable ex) {
        if (ex == null) {
            return false;
        }

        if (ex instanceof AmqpConnectException || ex instanceof AmqpTimeoutException) {
            return true;
        }
        if (ex instanceof CannotGetJdbcConnectionException
                || ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException) {
            return true;
        }
        if (ex instanceof ConnectException) {
            return true;
        }
        if (ex instanceof SQLTransientException
                || ex instanceof SQLRecoverableException
                || ex instanceof SQLNonTransientConnectionException) {
            return true;
        }

        String sqlState = getSqlState(ex);
        if (sqlState != null && SERVICE_SQL_STATES.contains(sqlState)) {
            return true;
        }

        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            for (String pattern : SERVICE_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return true;
                }
            }
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return isServiceError(cause);
        }

        return false;
    }

    /**
     * Determine if the exception reports a missing destination.
     */
    public static boolean isMissingDestination(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (UNDEFINED_TABLE_SQL_STATE.equals(getSqlState(current))) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Human-readable reason for a service error, used in result details.
     */
    public static String getServiceErrorReason(Throwable ex) {
        if (ex instanceof AmqpIOException || ex instanceof AmqpConnectException) {
            return "Broker connection failure";
        }
        if (ex instanceof IOException) {
            return "I/O failure";
        }
        String sqlState = getSqlState(ex);
        if (sqlState != null) {
            if (sqlState.startsWith("08")) {
                return "Connection failure (SQL state " + sqlState + ")";
            }
            if (sqlState.startsWith("53")) {
                return "Insufficient resources (SQL state " + sqlState + ")";
            }
            if (sqlState.startsWith("57")) {
                return "Service shutdown (SQL state " + sqlState + ")";
            }
        }
        return ex != null ? ex.getClass().getSimpleName() : "unknown";
    }

    /**
     * Get the SQL state from an exception if available.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        if (ex instanceof SQLException sqlEx) {
            return sqlEx.getSQLState();
        }
        Throwable cause = ex != null ? ex.getCause() : null;
        if (cause instanceof SQLException sqlEx) {
            return sqlEx.getSQLState();
        }
        return null;
    }
}
