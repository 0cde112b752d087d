/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.util.logging.ClientLogger;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

/**
 * Options read once by {@link AzureAuthorizer#create(AzureAuthConfiguration)}; later changes have no effect
 * on an authorizer already created.
 */
@Setter
@Getter
public class AzureAuthConfiguration {
    public static final String DEFAULT_USER_AGENT = "azauth";
    public static final String DEFAULT_LOGGER_NAME = "azauth";

    /**
     * Appended to the user agent of every client bound through {@link AzureAuthorizer#bindResource(String, io.github.azauth.lib.auth.client.AuthorizableClient)}.
     */
    private String userAgent = DEFAULT_USER_AGENT;
    /**
     * Path of the SDK auth file, overrides {@value EnvironmentSettings#AUTH_LOCATION}.
     */
    private String authFilePath;
    private Map<String, String> environmentVariables = System.getenv();
    private String userHome = System.getProperty("user.home");
    /**
     * Request one token while resolving so that rejected credentials fail over to the next source.
     * The CLI source always does.
     */
    private boolean verifyCredentials = true;
    private ClientLogger logger = new ClientLogger(DEFAULT_LOGGER_NAME);
    private ResolutionListener resolutionListener = ResolutionListener.NONE;
}
