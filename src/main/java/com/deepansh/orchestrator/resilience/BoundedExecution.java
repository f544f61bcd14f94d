package com.deepansh.orchestrator.resilience;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a suspension point (a generation call or a tool call) on the agent's executor
 * and waits for it at most the given timeout.
 *
 * On timeout the running future is cancelled and {@link TimeoutException} is thrown.
 * If the waiting thread is interrupted the future is cancelled too and the
 * {@link InterruptedException} propagates. Failures of the task itself propagate
 * unwrapped. Callers convert all three into step failure data.
 */
@Slf4j
public class BoundedExecution {

    private final AsyncTaskExecutor executor;

    public BoundedExecution(AsyncTaskExecutor executor) {
        this.executor = executor;
    }

    public <T> T call(String label, Callable<T> task, Duration timeout) throws Exception {
        TimeLimiter timeLimiter = TimeLimiter.of(label, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());

        AtomicReference<Future<T>> submitted = new AtomicReference<>();
        try {
            return timeLimiter.executeFutureSupplier(() -> {
                Future<T> future = executor.submit(task);
                submitted.set(future);
                return future;
            });
        } catch (TimeoutException e) {
            log.warn("[{}] timed out after {}ms", label, timeout.toMillis());
            throw e;
        } catch (InterruptedException e) {
            Future<T> future = submitted.get();
            if (future != null) {
                future.cancel(true);
            }
            log.warn("[{}] interrupted while waiting, cancelled", label);
            throw e;
        }
    }
}
