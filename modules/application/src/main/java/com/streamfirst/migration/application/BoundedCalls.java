package com.streamfirst.migration.application;

import com.streamfirst.migration.domain.CollaboratorUnavailableException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs collaborator calls on a separate executor so the caller can stop waiting after a
 * deadline. Every failure mode surfaces as {@link CollaboratorUnavailableException}, except
 * {@link IllegalArgumentException} which signals a malformed answer and is rethrown as is.
 */
final class BoundedCalls {

    private BoundedCalls() {
    }

    static <T> T call(ExecutorService executor, Duration timeout, String what, Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new CollaboratorUnavailableException(what + " rejected: executor shut down", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorUnavailableException(what + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorUnavailableException(what + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CollaboratorUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof IllegalArgumentException malformed) {
                throw malformed;
            }
            throw new CollaboratorUnavailableException(what + " failed: " + cause, cause);
        }
    }
}
