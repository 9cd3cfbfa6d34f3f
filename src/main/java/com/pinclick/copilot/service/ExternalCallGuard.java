package com.pinclick.copilot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking collaborator calls on a bounded pool so a slow dependency cannot hold a turn
 * (or another session) indefinitely. No call is retried here.
 */
@Service
public class ExternalCallGuard {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallGuard.class);

    private final AsyncTaskExecutor executor;
    private final long timeoutMs;

    public ExternalCallGuard(@Qualifier("externalCallExecutor") AsyncTaskExecutor executor,
                             @Value("${copilot.external.timeout-ms:8000}") long timeoutMs) {
        this.executor = executor;
        this.timeoutMs = Math.max(100, timeoutMs);
    }

    public <T> T call(String callName, Callable<T> task) {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {} ms", callName, timeoutMs);
            throw new ExternalCallTimeoutException(callName, timeoutMs, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(callName + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + callName, e);
        }
    }
}
