/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.util.logging.ClientLogger;
import io.github.azauth.lib.auth.cli.CliAuthorizerSource;
import io.github.azauth.lib.auth.client.AuthorizableClient;
import io.github.azauth.lib.auth.environment.EnvironmentAuthorizerSource;
import io.github.azauth.lib.auth.exception.NoAuthorizerAvailableException;
import io.github.azauth.lib.auth.exception.SettingsUnavailableException;
import io.github.azauth.lib.auth.file.FileAuthorizerSource;
import io.github.azauth.lib.auth.util.AzureEnvironmentUtils;
import lombok.Getter;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: resolves authorizers for Azure resources from, in order, an SDK auth file, the Azure CLI session
 * and environment variables, caches the resource management authorizer and binds authorizers to clients.
 * <p>
 * Environment settings are loaded once, by {@link #create(AzureAuthConfiguration)}.
 */
public class AzureAuthorizer {
    @Getter
    private final String userAgent;
    @Getter
    private final EnvironmentSettings settings;
    private final AuthorizerResolver resolver;
    private final ManagementAuthorizerCache cache;
    private final ClientAuthorizer clientAuthorizer;

    AzureAuthorizer(@Nonnull AzureAuthConfiguration config, @Nonnull EnvironmentSettings settings, @Nonnull List<? extends AuthorizerSource> sources) {
        final ClientLogger logger = loggerOf(config);
        this.userAgent = StringUtils.defaultIfBlank(config.getUserAgent(), AzureAuthConfiguration.DEFAULT_USER_AGENT);
        this.settings = Objects.requireNonNull(settings);
        this.resolver = new AuthorizerResolver(sources, settings.getResourceManagerEndpoint(), logger,
            ObjectUtils.defaultIfNull(config.getResolutionListener(), ResolutionListener.NONE));
        this.cache = new ManagementAuthorizerCache(resolver::resolveDefault, logger);
        this.clientAuthorizer = new ClientAuthorizer(resolver::resolveForResource, logger);
    }

    public static AzureAuthorizer create() {
        return create(new AzureAuthConfiguration());
    }

    /**
     * @throws SettingsUnavailableException if the environment settings cannot be loaded
     */
    public static AzureAuthorizer create(@Nonnull AzureAuthConfiguration config) {
        Objects.requireNonNull(config, "config");
        final EnvironmentSettings settings = loadSettings(config);
        final List<AuthorizerSource> sources = Arrays.asList(
            new FileAuthorizerSource(settings, config.getAuthFilePath(), config.isVerifyCredentials()),
            new CliAuthorizerSource(settings, config.getUserHome()),
            new EnvironmentAuthorizerSource(settings, config.isVerifyCredentials()));
        final AzureAuthorizer authorizer = new AzureAuthorizer(config, settings, sources);
        loggerOf(config).verbose("Loaded settings for cloud '{}'.", AzureEnvironmentUtils.azureEnvironmentToString(settings.getEnvironment()));
        return authorizer;
    }

    /**
     * @throws NoAuthorizerAvailableException if none of the sources produced an authorizer
     */
    public Authorizer resolveForResource(@Nonnull String resource) {
        return resolver.resolveForResource(resource);
    }

    public Authorizer resolveDefault() {
        return resolver.resolveDefault();
    }

    /**
     * Resolves through one source only, e.g. {@link AuthSource#FILE}.
     */
    public Authorizer resolveFromSource(@Nonnull AuthSource source, @Nonnull String resource) {
        return resolver.resolveFromSource(source, resource);
    }

    /**
     * Returns the cached resource management authorizer, resolving it on first use. Never invalidated.
     */
    public Authorizer getManagementAuthorizer() {
        return cache.getManagementAuthorizer();
    }

    public Authorizer bindResource(@Nonnull String resource, @Nonnull AuthorizableClient client, String userAgent) {
        return clientAuthorizer.bindResource(resource, client, userAgent);
    }

    public Authorizer bindResource(@Nonnull String resource, @Nonnull AuthorizableClient client) {
        return clientAuthorizer.bindResource(resource, client, this.userAgent);
    }

    /**
     * Binds an authorizer resolved through one source only, e.g. {@link AuthSource#FILE}. The client is left
     * unchanged if that source fails.
     */
    public Authorizer bindFromSource(@Nonnull AuthSource source, @Nonnull String resource, @Nonnull AuthorizableClient client) {
        return clientAuthorizer.bind(() -> resolver.resolveFromSource(source, resource), client, this.userAgent);
    }

    /**
     * Binds the cached resource management authorizer.
     */
    public Authorizer bindManagement(@Nonnull AuthorizableClient client) {
        return clientAuthorizer.bind(cache::getManagementAuthorizer, client, this.userAgent);
    }

    private static EnvironmentSettings loadSettings(AzureAuthConfiguration config) {
        final ClientLogger logger = loggerOf(config);
        final Map<String, String> variables = config.getEnvironmentVariables();
        if (variables == null) {
            throw logger.logExceptionAsError(new SettingsUnavailableException("No environment variables are available."));
        }
        try {
            return EnvironmentSettings.fromEnvironment(variables);
        } catch (SettingsUnavailableException e) {
            throw logger.logExceptionAsError(e);
        }
    }

    private static ClientLogger loggerOf(AzureAuthConfiguration config) {
        return ObjectUtils.defaultIfNull(config.getLogger(), new ClientLogger(AzureAuthConfiguration.DEFAULT_LOGGER_NAME));
    }
}
