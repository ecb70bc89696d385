package com.deepansh.gateway.stream;

import com.deepansh.gateway.context.CancellationToken;
import com.deepansh.gateway.context.CancelledException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedChannelTest {

    private final CancellationToken producer = new CancellationToken();
    private final CancellationToken consumer = new CancellationToken();

    @Test
    void bufferedItems_areDeliveredBeforeFailure() {
        BoundedChannel<String> channel = new BoundedChannel<>(4);
        channel.send("a", producer);
        channel.send("b", producer);
        IllegalStateException boom = new IllegalStateException("boom");

        channel.fail(boom);

        assertThat(channel.receive(consumer)).isEqualTo("a");
        assertThat(channel.receive(consumer)).isEqualTo("b");
        assertThat(channel.receive(consumer)).isNull();
        assertThat(channel.failure()).isSameAs(boom);
    }

    @Test
    void close_endsStreamWithoutFailure() {
        BoundedChannel<String> channel = new BoundedChannel<>(2);
        channel.send("a", producer);
        channel.close();

        assertThat(channel.receive(consumer)).isEqualTo("a");
        assertThat(channel.receive(consumer)).isNull();
        assertThat(channel.failure()).isNull();
        assertThat(channel.send("late", producer)).isFalse();
    }

    @Test
    void blockedReceiver_wakesOnCancellation() throws Exception {
        BoundedChannel<String> channel = new BoundedChannel<>(2);
        CompletableFuture<String> receiving = CompletableFuture.supplyAsync(() -> channel.receive(consumer));

        Thread.sleep(50);
        consumer.cancel();

        assertThatThrownBy(() -> receiving.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(CancelledException.class);
    }

    @Test
    void fullBuffer_blocksSenderUntilCancelled() throws Exception {
        BoundedChannel<String> channel = new BoundedChannel<>(1);
        channel.send("fills", producer);
        CompletableFuture<Boolean> sending = CompletableFuture.supplyAsync(() -> channel.send("blocked", producer));

        Thread.sleep(50);
        assertThat(sending).isNotDone();

        producer.cancel();

        assertThat(sending.get(2, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    void fullBuffer_unblocksWhenConsumerTakes() throws Exception {
        BoundedChannel<String> channel = new BoundedChannel<>(1);
        channel.send("first", producer);
        CompletableFuture<Boolean> sending = CompletableFuture.supplyAsync(() -> channel.send("second", producer));

        assertThat(channel.receive(consumer)).isEqualTo("first");

        assertThat(sending.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(channel.receive(consumer)).isEqualTo("second");
    }

    @Test
    void nonPositiveCapacity_isRejected() {
        assertThatThrownBy(() -> new BoundedChannel<String>(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
