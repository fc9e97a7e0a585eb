package com.rebalancer.concurrent;

import com.rebalancer.exception.BaseException;
import com.rebalancer.exception.SourceUnavailableException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs calls to an external source (broker, leaderboard) on a bounded pool and gives up on
 * them after a fixed timeout.
 *
 * <p>A call that times out, throws an unexpected exception, is interrupted or cannot be
 * queued because the pool is saturated surfaces as {@link SourceUnavailableException}.
 * Exceptions already in the rebalancer's hierarchy are rethrown unchanged. A timed-out call
 * is cancelled, but the source may still act on it and its pool thread stays busy until the
 * call returns.
 */
public class TimedCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimedCallExecutor.class);

    private final String source;
    private final Executor executor;
    private final Duration timeout;

    /**
     * @param source label used in log lines and error messages, e.g. "Broker"
     */
    public TimedCallExecutor(String source, Executor executor, Duration timeout) {
        this.source = source;
        this.executor = executor;
        this.timeout = timeout;
    }

    public <T> T call(String operation, Supplier<T> call) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException e) {
            log.warn("{} call {} rejected, call pool saturated: {}", source, operation, e.getMessage());
            throw new SourceUnavailableException(
                    source + " call " + operation + " rejected: call pool saturated", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} call {} timed out after {}ms", source, operation, timeout.toMillis());
            throw new SourceUnavailableException(
                    source + " call " + operation + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted during " + source + " call " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BaseException baseException) {
                throw baseException;
            }
            throw new SourceUnavailableException(
                    source + " call " + operation + " failed: " + cause.getMessage(), cause);
        }
    }

    public String getSource() {
        return source;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
