/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.environment;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.identity.UsernamePasswordCredentialBuilder;
import io.github.azauth.lib.auth.AuthSource;
import io.github.azauth.lib.auth.AuthorizerSource;
import io.github.azauth.lib.auth.EnvironmentSettings;
import io.github.azauth.lib.auth.exception.InvalidConfigurationException;
import io.github.azauth.lib.auth.exception.SourceUnavailableException;
import io.github.azauth.lib.auth.serviceprincipal.ServicePrincipalConfiguration;
import io.github.azauth.lib.auth.serviceprincipal.ServicePrincipalCredentials;
import io.github.azauth.lib.auth.util.ValidationUtil;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Mono;

import javax.annotation.Nonnull;

import static io.github.azauth.lib.auth.EnvironmentSettings.CERTIFICATE_PASSWORD;
import static io.github.azauth.lib.auth.EnvironmentSettings.CERTIFICATE_PATH;
import static io.github.azauth.lib.auth.EnvironmentSettings.CLIENT_ID;
import static io.github.azauth.lib.auth.EnvironmentSettings.CLIENT_SECRET;
import static io.github.azauth.lib.auth.EnvironmentSettings.PASSWORD;
import static io.github.azauth.lib.auth.EnvironmentSettings.TENANT_ID;
import static io.github.azauth.lib.auth.EnvironmentSettings.USERNAME;

/**
 * Credentials from environment variables: a client secret, else a client certificate, else a username and
 * password, always together with the tenant and client id.
 */
public class EnvironmentAuthorizerSource extends AuthorizerSource {

    public EnvironmentAuthorizerSource(@Nonnull EnvironmentSettings settings, boolean verifyCredentials) {
        super(AuthSource.ENVIRONMENT, settings, verifyCredentials);
    }

    @Override
    public Mono<Boolean> checkApplicable() {
        return Mono.fromCallable(() -> {
            if (isUsernamePassword()) {
                if (StringUtils.isAnyBlank(getSettings().getTenantId(), getSettings().getClientId())) {
                    throw new SourceUnavailableException(getSource(),
                        String.format("%s and %s are required together with %s.", TENANT_ID, CLIENT_ID, USERNAME));
                }
                return true;
            }
            try {
                ValidationUtil.validateServicePrincipal(toServicePrincipalConfiguration(getSettings().getActiveDirectoryEndpoint()));
            } catch (InvalidConfigurationException e) {
                throw new SourceUnavailableException(getSource(), String.format("invalid environment variables (%s, %s, %s or %s): %s",
                    TENANT_ID, CLIENT_ID, CLIENT_SECRET, CERTIFICATE_PATH, e.getMessage()));
            }
            return true;
        });
    }

    @Override
    protected TokenCredential createCredential(AzureEnvironment env) {
        if (isUsernamePassword()) {
            return new UsernamePasswordCredentialBuilder()
                .clientId(getSettings().getClientId())
                .tenantId(getSettings().getTenantId())
                .username(getSettings().getValue(USERNAME))
                .password(getSettings().getValue(PASSWORD))
                .authorityHost(env.getActiveDirectoryEndpoint())
                .build();
        }
        return ServicePrincipalCredentials.createCredential(toServicePrincipalConfiguration(env.getActiveDirectoryEndpoint()));
    }

    private boolean isUsernamePassword() {
        final EnvironmentSettings settings = getSettings();
        return StringUtils.isAllBlank(settings.getValue(CLIENT_SECRET), settings.getValue(CERTIFICATE_PATH))
            && StringUtils.isNoneBlank(settings.getValue(USERNAME), settings.getValue(PASSWORD));
    }

    private ServicePrincipalConfiguration toServicePrincipalConfiguration(String authorityHost) {
        final EnvironmentSettings settings = getSettings();
        final ServicePrincipalConfiguration config = new ServicePrincipalConfiguration();
        config.setTenant(settings.getTenantId());
        config.setClient(settings.getClientId());
        config.setKey(settings.getValue(CLIENT_SECRET));
        config.setCertificate(settings.getValue(CERTIFICATE_PATH));
        config.setCertificatePassword(settings.getValue(CERTIFICATE_PASSWORD));
        config.setAuthorityHost(authorityHost);
        return config;
    }
}
