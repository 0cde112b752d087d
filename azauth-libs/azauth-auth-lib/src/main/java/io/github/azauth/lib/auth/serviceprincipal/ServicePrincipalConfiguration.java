/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.serviceprincipal;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class ServicePrincipalConfiguration {
    private String client;
    private String tenant;
    private String key;
    private String certificate;
    private String certificatePassword;
    private String authorityHost;
}
