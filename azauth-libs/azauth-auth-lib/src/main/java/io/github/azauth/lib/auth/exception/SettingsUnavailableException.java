/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.exception;

public class SettingsUnavailableException extends AzureAuthorizationException {
    public SettingsUnavailableException(String message) {
        super(message);
    }

    public SettingsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
