/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.util.logging.ClientLogger;
import io.github.azauth.lib.auth.client.AuthorizableClient;
import io.github.azauth.lib.auth.exception.NoAuthorizerAvailableException;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Installs an authorizer and a user agent extension on a client, both or neither.
 */
public class ClientAuthorizer {
    private final Function<String, Authorizer> resolver;
    private final ClientLogger logger;

    public ClientAuthorizer(@Nonnull Function<String, Authorizer> resolver, @Nonnull ClientLogger logger) {
        this.resolver = Objects.requireNonNull(resolver);
        this.logger = Objects.requireNonNull(logger);
    }

    /**
     * @throws NoAuthorizerAvailableException if no authorizer can be resolved for the resource
     * @throws IllegalArgumentException       if the user agent is blank
     */
    public Authorizer bindResource(@Nonnull String resource, @Nonnull AuthorizableClient client, String userAgent) {
        return bind(() -> resolver.apply(resource), client, userAgent);
    }

    /**
     * Binds an already resolved authorizer, e.g. the cached management one.
     */
    public Authorizer bind(@Nonnull Supplier<Authorizer> authorizer, @Nonnull AuthorizableClient client, String userAgent) {
        Objects.requireNonNull(client, "client");
        if (StringUtils.isBlank(userAgent)) {
            throw logger.logExceptionAsError(new IllegalArgumentException(
                String.format("User agent extension was empty, client '%s' is left unchanged.", client.getUserAgent())));
        }
        final Authorizer resolved = authorizer.get();
        final Authorizer previous = client.getAuthorizer();
        client.setAuthorizer(resolved);
        try {
            client.addToUserAgent(userAgent);
        } catch (RuntimeException e) {
            client.setAuthorizer(previous);
            throw logger.logExceptionAsError(e);
        }
        logger.verbose("Bound authorizer from '{}' for resource '{}' to client '{}'.", resolved.getSource(), resolved.getResource(), client.getUserAgent());
        return resolved;
    }
}
