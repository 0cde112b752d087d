/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.credential.TokenCredential;
import com.azure.core.util.logging.ClientLogger;
import io.github.azauth.lib.auth.exception.NoAuthorizerAvailableException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ManagementAuthorizerCacheTest {
    private static final String MANAGEMENT = "https://management.azure.com/";

    private final ClientLogger logger = new ClientLogger(ManagementAuthorizerCacheTest.class);
    private final Authorizer authorizer = new Authorizer(AuthSource.CLI, MANAGEMENT, mock(TokenCredential.class));

    @Test
    void emptyAtConstruction() {
        var cache = new ManagementAuthorizerCache(() -> authorizer, logger);

        assertThat(cache.getCachedAuthorizer()).isEmpty();
    }

    @Test
    void secondCall_shouldReturnCachedAuthorizerWithoutResolving() {
        var calls = new AtomicInteger();
        var cache = new ManagementAuthorizerCache(() -> {
            calls.incrementAndGet();
            return authorizer;
        }, logger);

        var first = cache.getManagementAuthorizer();
        var second = cache.getManagementAuthorizer();

        assertThat(first).isSameAs(authorizer);
        assertThat(second).isSameAs(first);
        assertThat(calls).hasValue(1);
        assertThat(cache.getCachedAuthorizer()).containsSame(authorizer);
    }

    @Test
    void failure_shouldPropagateAndNotBeCached() {
        var calls = new AtomicInteger();
        var cache = new ManagementAuthorizerCache(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new NoAuthorizerAvailableException();
            }
            return authorizer;
        }, logger);

        assertThatThrownBy(cache::getManagementAuthorizer).isInstanceOf(NoAuthorizerAvailableException.class);
        assertThat(cache.getCachedAuthorizer()).isEmpty();

        assertThat(cache.getManagementAuthorizer()).isSameAs(authorizer);
        assertThat(calls).hasValue(2);
    }

    @Test
    void concurrentFirstCallers_shouldShareOneResolution() throws Exception {
        var calls = new AtomicInteger();
        var release = new CountDownLatch(1);
        var cache = new ManagementAuthorizerCache(() -> {
            calls.incrementAndGet();
            await(release);
            return authorizer;
        }, logger);
        var callers = startCallers(cache, 8);

        awaitBlocked(callers);
        release.countDown();

        for (var caller : callers) {
            assertThat(caller.get(5, TimeUnit.SECONDS)).isSameAs(authorizer);
        }
        assertThat(calls).hasValue(1);
    }

    @Test
    void concurrentFirstCallers_shouldShareFailure() throws Exception {
        var calls = new AtomicInteger();
        var release = new CountDownLatch(1);
        var cache = new ManagementAuthorizerCache(() -> {
            calls.incrementAndGet();
            await(release);
            throw new NoAuthorizerAvailableException();
        }, logger);
        var callers = startCallers(cache, 2);

        awaitBlocked(callers);
        release.countDown();

        for (var caller : callers) {
            assertThatThrownBy(() -> caller.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(NoAuthorizerAvailableException.class);
        }
        assertThat(calls).hasValue(1);
        assertThat(cache.getCachedAuthorizer()).isEmpty();
    }

    @Test
    void cacheHit_shouldBeLogged() {
        var cacheLogger = mock(ClientLogger.class);
        var cache = new ManagementAuthorizerCache(() -> authorizer, cacheLogger);

        cache.getManagementAuthorizer();
        cache.getManagementAuthorizer();
        cache.getManagementAuthorizer();

        verify(cacheLogger, times(2)).verbose(eq("Using cached management authorizer from '{}'."), eq(AuthSource.CLI));
    }

    @Test
    void resolverError_shouldReachCallerUnwrapped() {
        var cache = new ManagementAuthorizerCache(() -> {
            throw new AssertionError("resolver broke");
        }, logger);

        assertThatThrownBy(cache::getManagementAuthorizer)
                .isExactlyInstanceOf(AssertionError.class)
                .hasMessage("resolver broke");
        assertThat(cache.getCachedAuthorizer()).isEmpty();
    }

    private static List<Caller> startCallers(ManagementAuthorizerCache cache, int count) {
        var callers = new ArrayList<Caller>();
        for (int i = 0; i < count; i++) {
            var caller = new Caller(cache);
            callers.add(caller);
            caller.thread.start();
        }
        return callers;
    }

    /**
     * Waits until every caller is parked, either inside the resolver or waiting for the in-flight result.
     */
    private static void awaitBlocked(List<Caller> callers) throws InterruptedException {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!callers.stream().allMatch(Caller::isBlocked)) {
            assertThat(System.nanoTime()).isLessThan(deadline);
            Thread.sleep(5);
        }
    }

    private static class Caller {
        private final FutureTask<Authorizer> task;
        private final Thread thread;

        Caller(ManagementAuthorizerCache cache) {
            this.task = new FutureTask<>(cache::getManagementAuthorizer);
            this.thread = new Thread(task);
        }

        boolean isBlocked() {
            var state = thread.getState();
            return state == Thread.State.WAITING || state == Thread.State.TIMED_WAITING;
        }

        Authorizer get(long timeout, TimeUnit unit) throws Exception {
            return task.get(timeout, unit);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
