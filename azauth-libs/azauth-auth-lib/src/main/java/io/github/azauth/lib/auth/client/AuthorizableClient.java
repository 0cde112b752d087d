/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.client;

import io.github.azauth.lib.auth.Authorizer;

import javax.annotation.Nullable;

/**
 * An outbound client with a credential slot and a user agent.
 */
public interface AuthorizableClient {
    @Nullable
    Authorizer getAuthorizer();

    void setAuthorizer(Authorizer authorizer);

    String getUserAgent();

    /**
     * Appends a non-blank extension to the user agent, separated by a space.
     *
     * @throws IllegalArgumentException if the extension is blank, leaving the user agent unchanged
     */
    void addToUserAgent(String extension);
}
