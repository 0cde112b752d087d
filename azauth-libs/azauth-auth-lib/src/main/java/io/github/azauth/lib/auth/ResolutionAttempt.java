/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import javax.annotation.Nullable;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public class ResolutionAttempt {
    public enum Outcome {
        SUCCEEDED, FAILED
    }

    private final AuthSource source;
    private final Outcome outcome;
    @Nullable
    private final Throwable error;

    public static ResolutionAttempt succeeded(AuthSource source) {
        return new ResolutionAttempt(source, Outcome.SUCCEEDED, null);
    }

    public static ResolutionAttempt failed(AuthSource source, Throwable error) {
        return new ResolutionAttempt(source, Outcome.FAILED, error);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return error == null ? String.format("%s: %s", source, outcome) : String.format("%s: %s (%s)", source, outcome, error.getMessage());
    }
}
