/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.serviceprincipal;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientCertificateCredentialBuilder;
import com.azure.identity.ClientSecretCredentialBuilder;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;

public class ServicePrincipalCredentials {
    /**
     * Builds a client secret credential, or a certificate credential when a certificate is configured.
     * Certificates ending with {@code .pem} are read as PEM, anything else as PFX.
     */
    public static TokenCredential createCredential(@Nonnull ServicePrincipalConfiguration config) {
        if (StringUtils.isNotBlank(config.getCertificate())) {
            final ClientCertificateCredentialBuilder builder = new ClientCertificateCredentialBuilder()
                .clientId(config.getClient())
                .tenantId(config.getTenant())
                .authorityHost(config.getAuthorityHost());
            if (StringUtils.endsWithIgnoreCase(config.getCertificate(), ".pem")) {
                builder.pemCertificate(config.getCertificate());
            } else {
                builder.pfxCertificate(config.getCertificate(), config.getCertificatePassword());
            }
            return builder.build();
        }
        return new ClientSecretCredentialBuilder().clientId(config.getClient())
            .clientSecret(config.getKey())
            .tenantId(config.getTenant())
            .authorityHost(config.getAuthorityHost())
            .build();
    }
}
