/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.util.logging.ClientLogger;
import io.github.azauth.lib.auth.exception.NoAuthorizerAvailableException;
import io.github.azauth.lib.auth.exception.SourceUnavailableException;
import lombok.Getter;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Tries the credential sources in priority order (file, CLI, environment) and returns the authorizer of the
 * first one that succeeds. Per-source failures are logged and reported to the {@link ResolutionListener},
 * callers only ever see {@link NoAuthorizerAvailableException}.
 */
public class AuthorizerResolver {
    private final ClientLogger logger;
    private final ResolutionListener listener;
    @Getter
    private final String defaultResource;
    @Getter
    private final List<AuthorizerSource> sources;

    public AuthorizerResolver(@Nonnull List<? extends AuthorizerSource> sources, @Nonnull String defaultResource,
                              @Nonnull ClientLogger logger, @Nonnull ResolutionListener listener) {
        final List<AuthorizerSource> sorted = new ArrayList<>(sources);
        sorted.sort(Comparator.comparing(AuthorizerSource::getSource));
        this.sources = Collections.unmodifiableList(sorted);
        this.defaultResource = Objects.requireNonNull(defaultResource);
        this.logger = Objects.requireNonNull(logger);
        this.listener = Objects.requireNonNull(listener);
    }

    /**
     * @param resource passed as is to every source, not validated
     * @throws NoAuthorizerAvailableException if no source produced an authorizer
     */
    public Authorizer resolveForResource(@Nonnull String resource) {
        return resolve(resource, this.sources);
    }

    /**
     * Resolves for the resource management endpoint of the loaded cloud.
     */
    public Authorizer resolveDefault() {
        return resolveForResource(defaultResource);
    }

    /**
     * Resolves through a single source, failing the same way as {@link #resolveForResource(String)}.
     */
    public Authorizer resolveFromSource(@Nonnull AuthSource source, @Nonnull String resource) {
        final List<AuthorizerSource> selected = new ArrayList<>();
        for (final AuthorizerSource s : this.sources) {
            if (s.getSource() == source) {
                selected.add(s);
            }
        }
        return resolve(resource, selected);
    }

    private Authorizer resolve(String resource, List<AuthorizerSource> candidates) {
        final ResolutionAttemptLog attempts = new ResolutionAttemptLog(resource);
        try {
            for (final AuthorizerSource source : candidates) {
                try {
                    final Authorizer authorizer = source.resolve(resource);
                    attempts.add(ResolutionAttempt.succeeded(source.getSource()));
                    logger.atInfo()
                        .addKeyValue("method", source.getSource().getMethod())
                        .addKeyValue("resource", resource)
                        .log("ok");
                    return authorizer;
                } catch (SourceUnavailableException e) {
                    attempts.add(ResolutionAttempt.failed(source.getSource(), e));
                    logger.atWarning()
                        .addKeyValue("method", source.getSource().getMethod())
                        .addKeyValue("resource", resource)
                        .log(e.getMessage());
                }
            }
        } finally {
            listener.onResolution(attempts);
        }
        throw logger.logExceptionAsError(new NoAuthorizerAvailableException());
    }
}
