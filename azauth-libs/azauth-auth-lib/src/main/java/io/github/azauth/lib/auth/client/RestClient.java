/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.client;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpPipeline;
import com.azure.core.http.HttpPipelineBuilder;
import com.azure.core.http.policy.HttpPipelinePolicy;
import com.azure.core.http.policy.UserAgentPolicy;
import io.github.azauth.lib.auth.Authorizer;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Client settings turned into an azure-core {@link HttpPipeline}: the user agent and, once bound, a bearer token
 * policy of the authorizer.
 */
@Getter
public class RestClient implements AuthorizableClient {
    public static final String DEFAULT_USER_AGENT = "azauth-rest-client";

    @Setter
    private Authorizer authorizer;
    private String userAgent;

    public RestClient() {
        this(DEFAULT_USER_AGENT);
    }

    public RestClient(@Nonnull String userAgent) {
        this.userAgent = Objects.requireNonNull(userAgent);
    }

    @Override
    public void addToUserAgent(String extension) {
        if (StringUtils.isBlank(extension)) {
            throw new IllegalArgumentException(String.format("Extension was empty, user agent stayed as '%s'.", this.userAgent));
        }
        this.userAgent = StringUtils.isBlank(this.userAgent) ? extension.trim() : this.userAgent + " " + extension.trim();
    }

    public HttpPipeline buildPipeline(@Nonnull HttpClient httpClient) {
        final List<HttpPipelinePolicy> policies = new ArrayList<>();
        policies.add(new UserAgentPolicy(userAgent));
        if (authorizer != null) {
            policies.add(authorizer.toPipelinePolicy());
        }
        return new HttpPipelineBuilder()
            .httpClient(httpClient)
            .policies(policies.toArray(new HttpPipelinePolicy[0]))
            .build();
    }
}
