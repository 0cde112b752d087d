/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.core.util.logging.ClientLogger;
import io.github.azauth.lib.auth.exception.AzureAuthorizationException;
import io.github.azauth.lib.auth.exception.SourceUnavailableException;
import lombok.AccessLevel;
import lombok.Getter;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One way of obtaining credentials (file, CLI session, environment variables).
 * <p>
 * {@link #resolve(String)} runs three steps: {@link #checkApplicable()} tells whether the source is configured
 * at all, {@link #createCredential(AzureEnvironment)} builds the credential, and, when verification is
 * required, one token is requested for the resource so that rejected credentials fail here rather than on
 * the first request of the bound client.
 */
@Getter
public abstract class AuthorizerSource {
    private static final ClientLogger LOGGER = new ClientLogger(AuthorizerSource.class);

    private final AuthSource source;
    @Getter(AccessLevel.PROTECTED)
    private final EnvironmentSettings settings;
    @Getter(AccessLevel.NONE)
    private final boolean verifyCredentials;

    protected AuthorizerSource(@Nonnull AuthSource source, @Nonnull EnvironmentSettings settings, boolean verifyCredentials) {
        this.source = Objects.requireNonNull(source);
        this.settings = Objects.requireNonNull(settings);
        this.verifyCredentials = verifyCredentials;
    }

    /**
     * @return Mono = true if this source is configured, or an error describing what is missing
     */
    public abstract Mono<Boolean> checkApplicable();

    protected abstract TokenCredential createCredential(AzureEnvironment env);

    protected boolean isVerificationRequired() {
        return verifyCredentials;
    }

    /**
     * Resolves an authorizer for the resource, which is passed through unmodified.
     *
     * @throws SourceUnavailableException  if this source cannot produce credentials for the resource
     * @throws AzureAuthorizationException if the calling thread is interrupted while waiting for the source
     */
    public Authorizer resolve(@Nonnull String resource) {
        LOGGER.verbose("Resolving authorizer through '{}' for resource '{}'.", source, resource);
        final Authorizer authorizer;
        try {
            authorizer = checkApplicable()
                .map(ignore -> createCredential(settings.getEnvironment()))
                .map(credential -> new Authorizer(source, resource, credential))
                .flatMap(this::verify)
                .block();
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            final Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new AzureAuthorizationException(String.format("Resolution through '%s' was interrupted.", source), cause);
            }
            throw new SourceUnavailableException(source, e.getMessage(), e);
        }
        if (authorizer == null) {
            throw new SourceUnavailableException(source, "source is not applicable.");
        }
        return authorizer;
    }

    private Mono<Authorizer> verify(Authorizer authorizer) {
        if (!isVerificationRequired()) {
            return Mono.just(authorizer);
        }
        return authorizer.getToken()
            .switchIfEmpty(Mono.error(() -> new SourceUnavailableException(source,
                String.format("no access token was issued for resource '%s'.", authorizer.getResource()))))
            .onErrorMap(e -> !(e instanceof SourceUnavailableException), e -> new SourceUnavailableException(source,
                String.format("credentials were rejected for resource '%s': %s", authorizer.getResource(), e.getMessage()), e))
            .map(ignore -> authorizer);
    }
}
