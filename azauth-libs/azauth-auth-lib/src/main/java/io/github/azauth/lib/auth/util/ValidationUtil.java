/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.util;

import io.github.azauth.lib.auth.exception.InvalidConfigurationException;
import io.github.azauth.lib.auth.serviceprincipal.ServicePrincipalConfiguration;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.Paths;

public class ValidationUtil {
    public static void validateServicePrincipal(ServicePrincipalConfiguration config) throws InvalidConfigurationException {
        if (StringUtils.isBlank(config.getClient())) {
            throw new InvalidConfigurationException("client id is missing.");
        }
        if (StringUtils.isBlank(config.getTenant())) {
            throw new InvalidConfigurationException("tenant id is missing.");
        }
        if (StringUtils.isAllBlank(config.getKey(), config.getCertificate())) {
            throw new InvalidConfigurationException("client secret or certificate is missing.");
        }
        if (StringUtils.isNotBlank(config.getCertificate()) && !Files.isRegularFile(Paths.get(config.getCertificate()))) {
            throw new InvalidConfigurationException(String.format("certificate file '%s' does not exist.", config.getCertificate()));
        }
    }
}
