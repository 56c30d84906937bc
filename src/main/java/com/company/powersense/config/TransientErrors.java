package com.company.powersense.config;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.UnknownHostException;

/**
 * Classification of failures worth another attempt.
 */
public final class TransientErrors {

    private TransientErrors() {
    }

    /**
     * Store unavailable, connection lost, timeouts, and ClickHouse server errors that Spring
     * cannot translate. Grammar or integrity errors are not transient.
     */
    public static boolean isTransientStoreError(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof DataAccessResourceFailureException
                || error instanceof RecoverableDataAccessException
                || error instanceof UncategorizedSQLException;
    }

    /**
     * I/O failures and timeouts reaching the upstream API, and 5xx answers. An unresolvable host
     * is a configuration problem, not a transient one.
     */
    public static boolean isTransientUpstreamError(Throwable error) {
        if (error instanceof ResourceAccessException) {
            return !(error.getCause() instanceof UnknownHostException);
        }
        return error instanceof HttpServerErrorException;
    }
}
