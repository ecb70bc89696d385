package com.deepansh.gateway.llm;

import org.springframework.web.client.ResourceAccessException;

import java.util.function.Predicate;

/**
 * Decides which failures count against the llmClient circuit breaker: transport
 * errors, rate limits and server errors do; request-level rejections do not.
 */
public class ProviderFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ProviderException pe) {
            return pe.isRateLimit() || pe.isServerError();
        }
        return throwable instanceof ResourceAccessException;
    }
}
