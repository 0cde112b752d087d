/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.util;

import com.azure.core.management.AzureEnvironment;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AzureEnvironmentUtilsTest {

    @Test
    void stringToAzureEnvironment() {
        assertThat(AzureEnvironmentUtils.stringToAzureEnvironment("AzureUSGovernmentCloud")).contains(AzureEnvironment.AZURE_US_GOVERNMENT);
        assertThat(AzureEnvironmentUtils.stringToAzureEnvironment(" azurepubliccloud ")).contains(AzureEnvironment.AZURE);
        assertThat(AzureEnvironmentUtils.stringToAzureEnvironment("Mooncake")).isEmpty();
        assertThat(AzureEnvironmentUtils.stringToAzureEnvironment(null)).isEmpty();
    }

    @Test
    void azureEnvironmentToString() {
        assertThat(AzureEnvironmentUtils.azureEnvironmentToString(AzureEnvironment.AZURE_CHINA)).isEqualTo("AzureChinaCloud");
    }
}
