package com.deepansh.gateway.response;

import com.deepansh.gateway.config.GatewayProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory registry of asynchronous responses.
 *
 * One instance per process. A periodic sweep drops terminal entries older than the
 * retention window; entries still in progress are never swept.
 */
@Component
@Slf4j
public class ResponseManager {

    private final Map<String, ResponseState> responses = new ConcurrentHashMap<>();
    private final AtomicBoolean cleanupStarted = new AtomicBoolean(false);

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration sweepInterval;
    private final Duration retention;

    private volatile ScheduledFuture<?> cleanupTask;

    @Autowired
    public ResponseManager(@Qualifier("gatewayScheduler") TaskScheduler scheduler, GatewayProperties properties) {
        this(scheduler, Clock.systemUTC(),
                properties.getResponses().getSweepInterval(),
                properties.getResponses().getRetention());
    }

    public ResponseManager(TaskScheduler scheduler, Clock clock, Duration sweepInterval, Duration retention) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.sweepInterval = sweepInterval;
        this.retention = retention;
    }

    /**
     * Registers a new in-progress response. {@code cancelHandle} is run when the
     * response is cancelled or deleted while still running.
     */
    public ResponseState create(Runnable cancelHandle) {
        ResponseState state = new ResponseState(ResponseIds.newResponseId(), clock.instant(), cancelHandle);
        responses.put(state.getId(), state);
        log.debug("Response registered [id={}]", state.getId());
        return state;
    }

    public Optional<ResponseState> get(String id) {
        return Optional.ofNullable(responses.get(id));
    }

    public ResponseState cancel(String id) {
        ResponseState state = get(id).orElseThrow(() -> new ResponseNotFoundException(id));
        if (state.cancel()) {
            log.info("Response cancelled [id={}]", id);
        }
        return state;
    }

    /** Removes the entry, cancelling it first if it is still running. */
    public void delete(String id) {
        ResponseState state = get(id).orElseThrow(() -> new ResponseNotFoundException(id));
        if (!state.isTerminal()) {
            state.cancel();
        }
        responses.remove(id);
        log.info("Response deleted [id={}]", id);
    }

    /** Drops every terminal entry created more than {@code maxAge} ago. */
    public int cleanupOldResponses(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (ResponseState state : responses.values()) {
            if (state.isExpired(cutoff) && responses.remove(state.getId(), state)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Response sweep removed {} entr{} [remaining={}]",
                    removed, removed == 1 ? "y" : "ies", responses.size());
        }
        return removed;
    }

    /** Schedules the periodic sweep. Calls after the first are no-ops. */
    @PostConstruct
    public void startCleanupTask() {
        if (!cleanupStarted.compareAndSet(false, true)) {
            return;
        }
        cleanupTask = scheduler.scheduleAtFixedRate(
                () -> cleanupOldResponses(retention),
                clock.instant().plus(sweepInterval),
                sweepInterval);
        log.info("Response sweep scheduled [interval={}, retention={}]", sweepInterval, retention);
    }

    @PreDestroy
    public void stopCleanupTask() {
        ScheduledFuture<?> task = cleanupTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    public int size() {
        return responses.size();
    }
}
