/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.core.management.AzureEnvironment;
import io.github.azauth.lib.auth.exception.AzureAuthorizationException;
import io.github.azauth.lib.auth.exception.SourceUnavailableException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthorizerSourceTest {
    private static final String RESOURCE = "https://management.azure.com/";

    private final TokenCredential credential = mock(TokenCredential.class);

    @Test
    void verificationDisabled_shouldNotRequestToken() {
        var authorizer = source(false).resolve(RESOURCE);

        assertThat(authorizer.getCredential()).isSameAs(credential);
        verify(credential, never()).getToken(any(TokenRequestContext.class));
    }

    @Test
    void rejectedCredentials_shouldBeUnavailable() {
        when(credential.getToken(any(TokenRequestContext.class))).thenReturn(Mono.error(new RuntimeException("invalid_client")));

        assertThatThrownBy(() -> source(true).resolve(RESOURCE))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("rejected")
                .hasMessageContaining("invalid_client");
    }

    @Test
    void noTokenIssued_shouldBeUnavailable() {
        when(credential.getToken(any(TokenRequestContext.class))).thenReturn(Mono.empty());

        assertThatThrownBy(() -> source(true).resolve(RESOURCE))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("no access token");
    }

    @Test
    void issuedToken_shouldResolve() {
        when(credential.getToken(any(TokenRequestContext.class)))
                .thenReturn(Mono.just(new AccessToken("token", OffsetDateTime.now().plusHours(1))));

        var authorizer = source(true).resolve(RESOURCE);

        assertThat(authorizer.getResource()).isEqualTo(RESOURCE);
        assertThat(authorizer.getScopes()).containsExactly("https://management.azure.com/.default");
    }

    @Test
    void unexpectedFailure_shouldBeWrappedAsUnavailable() {
        var source = new AuthorizerSource(AuthSource.ENVIRONMENT, EnvironmentSettings.fromEnvironment(Map.of()), false) {
            @Override
            public Mono<Boolean> checkApplicable() {
                return Mono.just(true);
            }

            @Override
            protected TokenCredential createCredential(AzureEnvironment env) {
                throw new IllegalStateException("boom");
            }
        };

        assertThatThrownBy(() -> source.resolve(RESOURCE))
                .isInstanceOf(SourceUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((SourceUnavailableException) e).getSource()).isEqualTo(AuthSource.ENVIRONMENT));
    }

    @Test
    void emptyApplicabilityCheck_shouldBeUnavailable() {
        var source = new AuthorizerSource(AuthSource.CLI, EnvironmentSettings.fromEnvironment(Map.of()), false) {
            @Override
            public Mono<Boolean> checkApplicable() {
                return Mono.empty();
            }

            @Override
            protected TokenCredential createCredential(AzureEnvironment env) {
                return credential;
            }
        };

        assertThatThrownBy(() -> source.resolve(RESOURCE)).isInstanceOf(SourceUnavailableException.class);
    }

    @Test
    void interruptedCaller_shouldNotBeReportedAsUnavailable() {
        var source = new AuthorizerSource(AuthSource.FILE, EnvironmentSettings.fromEnvironment(Map.of()), false) {
            @Override
            public Mono<Boolean> checkApplicable() {
                return Mono.never();
            }

            @Override
            protected TokenCredential createCredential(AzureEnvironment env) {
                return credential;
            }
        };

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> source.resolve(RESOURCE))
                    .isExactlyInstanceOf(AzureAuthorizationException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    private AuthorizerSource source(boolean verify) {
        return new AuthorizerSource(AuthSource.FILE, EnvironmentSettings.fromEnvironment(Map.of()), verify) {
            @Override
            public Mono<Boolean> checkApplicable() {
                return Mono.just(true);
            }

            @Override
            protected TokenCredential createCredential(AzureEnvironment env) {
                return credential;
            }
        };
    }
}
