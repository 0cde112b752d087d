/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.management.AzureEnvironment;
import io.github.azauth.lib.auth.exception.SettingsUnavailableException;
import io.github.azauth.lib.auth.util.AzureEnvironmentUtils;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ambient settings read from the process environment: the Azure cloud and the service principal or user
 * values consumed by the environment credential source.
 */
public class EnvironmentSettings {
    public static final String ENVIRONMENT_NAME = "AZURE_ENVIRONMENT";
    public static final String SUBSCRIPTION_ID = "AZURE_SUBSCRIPTION_ID";
    public static final String TENANT_ID = "AZURE_TENANT_ID";
    public static final String CLIENT_ID = "AZURE_CLIENT_ID";
    public static final String CLIENT_SECRET = "AZURE_CLIENT_SECRET";
    public static final String CERTIFICATE_PATH = "AZURE_CERTIFICATE_PATH";
    public static final String CERTIFICATE_PASSWORD = "AZURE_CERTIFICATE_PASSWORD";
    public static final String USERNAME = "AZURE_USERNAME";
    public static final String PASSWORD = "AZURE_PASSWORD";
    public static final String AUTH_LOCATION = "AZURE_AUTH_LOCATION";
    public static final String CONFIG_DIR = "AZURE_CONFIG_DIR";

    @Getter
    private final String environmentName;
    @Getter
    private final AzureEnvironment environment;
    private final Map<String, String> values;

    private EnvironmentSettings(String environmentName, AzureEnvironment environment, Map<String, String> values) {
        this.environmentName = environmentName;
        this.environment = environment;
        this.values = values;
    }

    /**
     * Loads the settings from the given environment variables.
     *
     * @throws SettingsUnavailableException if {@value #ENVIRONMENT_NAME} names an unknown cloud
     */
    public static EnvironmentSettings fromEnvironment(@Nonnull Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables");
        final Map<String, String> values = new HashMap<>();
        variables.forEach((key, value) -> {
            if (StringUtils.startsWith(key, "AZURE_") && StringUtils.isNotBlank(value)) {
                values.put(key, value.trim());
            }
        });
        final String name = values.getOrDefault(ENVIRONMENT_NAME, AzureEnvironmentUtils.AZURE_PUBLIC_CLOUD);
        final AzureEnvironment env = AzureEnvironmentUtils.stringToAzureEnvironment(name)
            .orElseThrow(() -> new SettingsUnavailableException(String.format(
                "Cannot load environment settings: unknown Azure cloud '%s' in %s, expected one of %s",
                name, ENVIRONMENT_NAME, AzureEnvironmentUtils.getClouds().keySet())));
        return new EnvironmentSettings(name, env, Collections.unmodifiableMap(values));
    }

    @Nullable
    public String getValue(@Nonnull String key) {
        return values.get(key);
    }

    public String getSubscriptionId() {
        return values.get(SUBSCRIPTION_ID);
    }

    public String getTenantId() {
        return values.get(TENANT_ID);
    }

    public String getClientId() {
        return values.get(CLIENT_ID);
    }

    /**
     * The resource management endpoint of the loaded cloud, the scope of the cached management authorizer.
     */
    public String getResourceManagerEndpoint() {
        return environment.getResourceManagerEndpoint();
    }

    public String getActiveDirectoryEndpoint() {
        return environment.getActiveDirectoryEndpoint();
    }
}
