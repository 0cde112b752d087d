/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.github.azauth.lib.auth.serviceprincipal.ServicePrincipalConfiguration;
import lombok.Getter;
import lombok.Setter;

/**
 * Content of an SDK auth file, as written by {@code az ad sp create-for-rbac --sdk-auth}.
 * Endpoint keys other than the active directory one are ignored.
 */
@Setter
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthFile {
    private String clientId;
    private String clientSecret;
    private String clientCertificate;
    private String clientCertificatePassword;
    private String subscriptionId;
    private String tenantId;
    private String activeDirectoryEndpointUrl;

    public ServicePrincipalConfiguration toServicePrincipalConfiguration() {
        final ServicePrincipalConfiguration config = new ServicePrincipalConfiguration();
        config.setClient(clientId);
        config.setTenant(tenantId);
        config.setKey(clientSecret);
        config.setCertificate(clientCertificate);
        config.setCertificatePassword(clientCertificatePassword);
        config.setAuthorityHost(activeDirectoryEndpointUrl);
        return config;
    }
}
