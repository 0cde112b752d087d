/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.exception;

import io.github.azauth.lib.auth.AuthSource;
import lombok.Getter;

/**
 * A single credential source could not produce an authorizer. Recovered inside the resolver and only logged.
 */
@Getter
public class SourceUnavailableException extends AzureAuthorizationException {
    private final AuthSource source;

    public SourceUnavailableException(AuthSource source, String message) {
        super(String.format("Cannot get authorizer through '%s': %s", source, message));
        this.source = source;
    }

    public SourceUnavailableException(AuthSource source, String message, Throwable cause) {
        super(String.format("Cannot get authorizer through '%s': %s", source, message), cause);
        this.source = source;
    }
}
