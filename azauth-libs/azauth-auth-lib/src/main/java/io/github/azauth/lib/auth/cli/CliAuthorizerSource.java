/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.cli;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.identity.AzureCliCredentialBuilder;
import io.github.azauth.lib.auth.AuthSource;
import io.github.azauth.lib.auth.AuthorizerSource;
import io.github.azauth.lib.auth.EnvironmentSettings;
import io.github.azauth.lib.auth.exception.SourceUnavailableException;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Mono;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Credentials of the Azure CLI login session. The session is opaque, so a token is always requested while
 * resolving.
 */
public class CliAuthorizerSource extends AuthorizerSource {
    static final String CLI_CONFIG_DIR = ".azure";
    static final String CLI_PROFILE = "azureProfile.json";

    @Nullable
    private final String userHome;

    public CliAuthorizerSource(@Nonnull EnvironmentSettings settings, @Nullable String userHome) {
        super(AuthSource.CLI, settings, true);
        this.userHome = userHome;
    }

    /**
     * {@value EnvironmentSettings#CONFIG_DIR} if set, otherwise {@code ~/.azure}.
     */
    @Nullable
    public Path getConfigDir() {
        final String configDir = getSettings().getValue(EnvironmentSettings.CONFIG_DIR);
        if (StringUtils.isNotBlank(configDir)) {
            return Paths.get(configDir);
        }
        return StringUtils.isBlank(userHome) ? null : Paths.get(userHome, CLI_CONFIG_DIR);
    }

    @Override
    public Mono<Boolean> checkApplicable() {
        return Mono.fromCallable(() -> {
            final Path configDir = getConfigDir();
            if (configDir == null || !Files.isRegularFile(configDir.resolve(CLI_PROFILE))) {
                throw new SourceUnavailableException(getSource(),
                    String.format("no Azure CLI session found in '%s', run 'az login' first.", configDir));
            }
            return true;
        });
    }

    @Override
    protected TokenCredential createCredential(AzureEnvironment env) {
        return new AzureCliCredentialBuilder().build();
    }

    @Override
    protected boolean isVerificationRequired() {
        return true;
    }
}
