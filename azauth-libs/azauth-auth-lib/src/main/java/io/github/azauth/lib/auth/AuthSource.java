/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Credential sources, declared in resolution priority order.
 */
@Getter
@RequiredArgsConstructor
public enum AuthSource {
    FILE("file"),
    CLI("cli"),
    ENVIRONMENT("env");

    private final String method;

    @Override
    public String toString() {
        return method;
    }
}
