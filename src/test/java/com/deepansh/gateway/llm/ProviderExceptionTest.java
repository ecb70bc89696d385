package com.deepansh.gateway.llm;

import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderExceptionTest {

    @Test
    void message_includesTypeAndCode() {
        ProviderException e = ProviderException.rateLimit("Slow down");

        assertThat(e.getMessage()).isEqualTo("provider: rate_limit_error (rate_limit_exceeded): Slow down");
        assertThat(e.getErrorType()).isEqualTo("rate_limit_error");
    }

    @Test
    void classification_followsStatusAndCode() {
        assertThat(ProviderException.tokenLimit("too long").isTokenLimit()).isTrue();
        assertThat(ProviderException.tokenLimit("too long").isInvalidRequest()).isTrue();
        assertThat(ProviderException.authentication("no").isAuthentication()).isTrue();
        assertThat(ProviderException.serverError("down").isRetryable()).isTrue();
        assertThat(ProviderException.invalidRequest("bad").isRetryable()).isFalse();
        assertThat(new ProviderException(404, "not_found_error", "no model", null, null).isNotFound()).isTrue();
    }

    @Test
    void missingType_reportsGenericProviderError() {
        ProviderException e = new ProviderException(500, null, "boom", null, null);

        assertThat(e.getErrorType()).isEqualTo("provider_error");
    }

    @Test
    void failurePredicate_countsOnlyTransientFailures() {
        ProviderFailurePredicate predicate = new ProviderFailurePredicate();

        assertThat(predicate.test(ProviderException.rateLimit("x"))).isTrue();
        assertThat(predicate.test(ProviderException.serverError("x"))).isTrue();
        assertThat(predicate.test(new ResourceAccessException("connect timed out"))).isTrue();
        assertThat(predicate.test(ProviderException.invalidRequest("x"))).isFalse();
        assertThat(predicate.test(new IllegalStateException("x"))).isFalse();
    }
}
