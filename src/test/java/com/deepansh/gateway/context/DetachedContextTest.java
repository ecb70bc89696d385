package com.deepansh.gateway.context;

import com.deepansh.gateway.tool.ToolObserver;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;

class DetachedContextTest {

    @Test
    void survivesParentCancellation_andStillReadsParentEnvironment() {
        ToolObserver observer = mock(ToolObserver.class);
        CancellableContext parent = CancellableContext.of(
                RequestEnvironment.builder().observer(observer).build());

        try (DetachedContext detached = DetachedContext.detach(parent, Duration.ofMinutes(1))) {
            parent.cancel();

            assertThat(detached.isCancelled()).isFalse();
            assertThat(detached.environment().toolObserver()).containsSame(observer);
            assertThat(detached.deadline()).isPresent();
        }
    }

    @Test
    void expiresOnItsOwnTimeout() {
        try (DetachedContext detached = DetachedContext.detach(CancellableContext.background(), Duration.ofMillis(50))) {
            await().atMost(2, TimeUnit.SECONDS).until(detached::isCancelled);

            assertThat(detached.cancellation().cause()).isInstanceOf(DeadlineExceededException.class);
        }
    }

    @Test
    void zeroTimeout_meansNoDeadline() {
        try (DetachedContext detached = DetachedContext.detach(CancellableContext.background(), Duration.ZERO)) {
            assertThat(detached.deadline()).isEmpty();
            assertThat(detached.isCancelled()).isFalse();
        }
    }

    @Test
    void close_cancelsTheContext() {
        DetachedContext detached = DetachedContext.detach(CancellableContext.background(), Duration.ofMinutes(1));

        detached.close();

        assertThat(detached.isCancelled()).isTrue();
    }

    @Test
    void suspension_returnsAsSoonAsContextIsCancelled() {
        ExecutorService executor = Executors.newCachedThreadPool();
        try (CancellableContext ctx = CancellableContext.background()) {
            CompletableFuture<Object> waiter = CompletableFuture.supplyAsync(() ->
                    Suspensions.await(ctx, executor, () -> {
                        Thread.sleep(10_000);
                        return "late";
                    }));

            ctx.cancel();

            assertThatThrownBy(() -> waiter.get(2, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(CancelledException.class);
        } finally {
            executor.shutdownNow();
        }
    }
}
