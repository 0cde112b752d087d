/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.util.logging.ClientLogger;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Single slot holding the resource management authorizer.
 * <p>
 * The slot is filled by the first successful resolution and never invalidated: there is no expiry check,
 * token refresh is left to the credential itself. Failures are not cached. Concurrent callers arriving while
 * the slot is empty wait for one in-flight resolution and share its outcome.
 */
public class ManagementAuthorizerCache {
    private final Supplier<Authorizer> resolver;
    private final ClientLogger logger;

    private final Object lock = new Object();
    private volatile Authorizer authorizer;
    private CompletableFuture<Authorizer> inFlight;

    public ManagementAuthorizerCache(@Nonnull Supplier<Authorizer> resolver, @Nonnull ClientLogger logger) {
        this.resolver = Objects.requireNonNull(resolver);
        this.logger = Objects.requireNonNull(logger);
    }

    public Authorizer getManagementAuthorizer() {
        final Authorizer cached = this.authorizer;
        if (cached != null) {
            return hit(cached);
        }
        final CompletableFuture<Authorizer> flight;
        final boolean owner;
        synchronized (lock) {
            if (this.authorizer != null) {
                return hit(this.authorizer);
            }
            owner = this.inFlight == null;
            if (owner) {
                this.inFlight = new CompletableFuture<>();
            }
            flight = this.inFlight;
        }
        if (owner) {
            resolve(flight);
        } else {
            logger.verbose("Waiting for in-flight management authorizer resolution.");
        }
        return await(flight);
    }

    public Optional<Authorizer> getCachedAuthorizer() {
        return Optional.ofNullable(this.authorizer);
    }

    private Authorizer hit(Authorizer cached) {
        logger.verbose("Using cached management authorizer from '{}'.", cached.getSource());
        return cached;
    }

    private void resolve(CompletableFuture<Authorizer> flight) {
        try {
            final Authorizer resolved = resolver.get();
            synchronized (lock) {
                this.authorizer = resolved;
                this.inFlight = null;
            }
            flight.complete(resolved);
        } catch (RuntimeException | Error e) {
            synchronized (lock) {
                this.inFlight = null;
            }
            flight.completeExceptionally(e);
        }
    }

    private static Authorizer await(CompletableFuture<Authorizer> flight) {
        try {
            return flight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        }
    }
}
