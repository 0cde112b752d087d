/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.core.http.policy.BearerTokenAuthenticationPolicy;
import com.azure.core.http.policy.HttpPipelinePolicy;
import com.azure.identity.implementation.util.ScopeUtil;
import lombok.Getter;
import reactor.core.publisher.Mono;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A credential bound to the resource it was resolved for. Immutable, safe to cache and share.
 */
@Getter
public class Authorizer {
    private final AuthSource source;
    private final String resource;
    private final TokenCredential credential;

    public Authorizer(@Nonnull AuthSource source, @Nonnull String resource, @Nonnull TokenCredential credential) {
        this.source = Objects.requireNonNull(source, "source");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.credential = Objects.requireNonNull(credential, "credential");
    }

    public String[] getScopes() {
        return ScopeUtil.resourceToScopes(resource);
    }

    public TokenRequestContext getTokenRequestContext() {
        return new TokenRequestContext().addScopes(getScopes());
    }

    public Mono<AccessToken> getToken() {
        return credential.getToken(getTokenRequestContext());
    }

    /**
     * Policy signing every request of a pipeline with a bearer token for {@link #getResource()}.
     */
    public HttpPipelinePolicy toPipelinePolicy() {
        return new BearerTokenAuthenticationPolicy(credential, getScopes());
    }

    @Override
    public String toString() {
        return String.format("Authorizer{source=%s, resource=%s}", source, resource);
    }
}
