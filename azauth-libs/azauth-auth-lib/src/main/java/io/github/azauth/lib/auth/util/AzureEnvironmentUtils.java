/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.util;

import com.azure.core.management.AzureEnvironment;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class AzureEnvironmentUtils {
    public static final String AZURE_PUBLIC_CLOUD = "AzurePublicCloud";

    private static final Map<String, AzureEnvironment> CLOUDS;

    static {
        final Map<String, AzureEnvironment> clouds = new LinkedHashMap<>();
        clouds.put(AZURE_PUBLIC_CLOUD, AzureEnvironment.AZURE);
        clouds.put("AzureChinaCloud", AzureEnvironment.AZURE_CHINA);
        clouds.put("AzureUSGovernmentCloud", AzureEnvironment.AZURE_US_GOVERNMENT);
        clouds.put("AzureGermanCloud", AzureEnvironment.AZURE_GERMANY);
        CLOUDS = Collections.unmodifiableMap(clouds);
    }

    /**
     * Looks up a cloud by name, case-insensitively, e.g. {@code AzurePublicCloud} or {@code AZURECHINACLOUD}.
     */
    public static Optional<AzureEnvironment> stringToAzureEnvironment(@Nullable String name) {
        final String trimmed = StringUtils.trim(name);
        return CLOUDS.entrySet().stream()
            .filter(e -> StringUtils.equalsIgnoreCase(e.getKey(), trimmed))
            .map(Map.Entry::getValue)
            .findFirst();
    }

    public static String azureEnvironmentToString(@Nonnull AzureEnvironment env) {
        return CLOUDS.entrySet().stream()
            .filter(e -> e.getValue() == env)
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(StringUtils.removeEnd(env.getResourceManagerEndpoint(), "/"));
    }

    public static Map<String, AzureEnvironment> getClouds() {
        return CLOUDS;
    }
}
