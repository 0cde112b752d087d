/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.exception;

public class AzureAuthorizationException extends RuntimeException {
    public AzureAuthorizationException(String message) {
        super(message);
    }

    public AzureAuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
