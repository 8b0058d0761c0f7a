package com.flagship.ad_escrow.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs calls to the chat platform with a hard per-call timeout.
 *
 * A call that outlives its timeout is cancelled and reported as {@link TimeoutException};
 * the caller decides whether that is transient. Unchecked exceptions thrown by the
 * call surface unchanged, checked ones wrapped in {@link CompletionException}.
 */
@Component
@Slf4j
public class OutboundCallExecutor implements DisposableBean {

    private final ExecutorService executor;

    public OutboundCallExecutor(@Value("${engine.outbound.pool-size:8}") int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, "outbound-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> T call(String operation, Callable<T> call, Duration timeout) throws TimeoutException {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Outbound call timed out: operation={}, timeoutMs={}", operation, timeout.toMillis());
            throw new TimeoutException(operation + " timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TimeoutException(operation + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
