/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.exception;

/**
 * No credential source (file, CLI, environment) produced an authorizer.
 * Carries no per-source detail, the specific failures are logged instead.
 */
public class NoAuthorizerAvailableException extends AzureAuthorizationException {
    public static final String MESSAGE = "no authorizer available";

    public NoAuthorizerAvailableException() {
        super(MESSAGE);
    }
}
