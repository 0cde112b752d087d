/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

/**
 * Receives the attempt log of every resolution, successful or not.
 */
@FunctionalInterface
public interface ResolutionListener {
    ResolutionListener NONE = log -> {
    };

    void onResolution(ResolutionAttemptLog log);
}
