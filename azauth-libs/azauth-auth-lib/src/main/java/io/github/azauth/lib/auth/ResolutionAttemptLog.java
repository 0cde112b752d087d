/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Sources tried by one resolution call, in the order they were tried.
 */
public class ResolutionAttemptLog {
    @Getter
    private final String resource;
    private final List<ResolutionAttempt> attempts = new ArrayList<>();

    public ResolutionAttemptLog(String resource) {
        this.resource = resource;
    }

    void add(ResolutionAttempt attempt) {
        this.attempts.add(attempt);
    }

    public List<ResolutionAttempt> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    public List<AuthSource> getAttemptedSources() {
        return attempts.stream().map(ResolutionAttempt::getSource).collect(Collectors.toList());
    }

    public Optional<AuthSource> getSucceededSource() {
        return attempts.stream()
            .filter(a -> a.getOutcome() == ResolutionAttempt.Outcome.SUCCEEDED)
            .map(ResolutionAttempt::getSource)
            .findFirst();
    }

    public boolean isExhausted() {
        return !getSucceededSource().isPresent();
    }

    @Override
    public String toString() {
        return String.format("%s -> %s", resource, attempts);
    }
}
