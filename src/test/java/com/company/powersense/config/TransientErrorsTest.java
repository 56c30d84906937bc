package com.company.powersense.config;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class TransientErrorsTest {

    @Test
    void connectionAndTimeoutFailuresAreRetriedAgainstTheStore() {
        assertThat(TransientErrors.isTransientStoreError(new DataAccessResourceFailureException("refused"))).isTrue();
        assertThat(TransientErrors.isTransientStoreError(new QueryTimeoutException("slow"))).isTrue();
    }

    @Test
    void grammarAndIntegrityErrorsAreNotRetried() {
        assertThat(TransientErrors.isTransientStoreError(
                new BadSqlGrammarException("insert", "INSERT", new SQLException("syntax")))).isFalse();
        assertThat(TransientErrors.isTransientStoreError(new DataIntegrityViolationException("dup"))).isFalse();
        assertThat(TransientErrors.isTransientStoreError(new IllegalStateException("bug"))).isFalse();
    }

    @Test
    void upstreamServerErrorsAndTimeoutsAreRetried() {
        assertThat(TransientErrors.isTransientUpstreamError(
                HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "bad gateway", null, null, null))).isTrue();
        assertThat(TransientErrors.isTransientUpstreamError(
                new ResourceAccessException("timeout", new SocketTimeoutException("read timed out")))).isTrue();
    }

    @Test
    void unresolvableHostAndClientErrorsAreNotRetried() {
        assertThat(TransientErrors.isTransientUpstreamError(
                new ResourceAccessException("dns", new UnknownHostException("nowhere.invalid")))).isFalse();
        assertThat(TransientErrors.isTransientUpstreamError(
                HttpClientErrorException.create(HttpStatus.NOT_FOUND, "not found", null, null, null))).isFalse();
        assertThat(TransientErrors.isTransientUpstreamError(new IOException("raw"))).isFalse();
    }
}
