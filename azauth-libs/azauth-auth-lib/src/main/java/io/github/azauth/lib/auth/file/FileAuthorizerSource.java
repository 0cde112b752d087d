/*
 * Copyright (c) Microsoft Corporation. All rights reserved.
 * Licensed under the MIT License. See License.txt in the project root for license information.
 */

package io.github.azauth.lib.auth.file;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.core.util.logging.ClientLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.azauth.lib.auth.AuthSource;
import io.github.azauth.lib.auth.AuthorizerSource;
import io.github.azauth.lib.auth.EnvironmentSettings;
import io.github.azauth.lib.auth.exception.InvalidConfigurationException;
import io.github.azauth.lib.auth.exception.SourceUnavailableException;
import io.github.azauth.lib.auth.serviceprincipal.ServicePrincipalConfiguration;
import io.github.azauth.lib.auth.serviceprincipal.ServicePrincipalCredentials;
import io.github.azauth.lib.auth.util.ValidationUtil;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Mono;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Service principal credentials from an SDK auth file, located by the configured path or
 * {@value EnvironmentSettings#AUTH_LOCATION}.
 */
public class FileAuthorizerSource extends AuthorizerSource {
    private static final ClientLogger LOGGER = new ClientLogger(FileAuthorizerSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Nullable
    private final String authFilePath;

    public FileAuthorizerSource(@Nonnull EnvironmentSettings settings, @Nullable String authFilePath, boolean verifyCredentials) {
        super(AuthSource.FILE, settings, verifyCredentials);
        this.authFilePath = authFilePath;
    }

    @Nullable
    public Path getAuthFilePath() {
        final String path = StringUtils.isNotBlank(authFilePath) ? authFilePath : getSettings().getValue(EnvironmentSettings.AUTH_LOCATION);
        return StringUtils.isBlank(path) ? null : Paths.get(path);
    }

    @Override
    public Mono<Boolean> checkApplicable() {
        return Mono.fromCallable(() -> {
            final Path path = getAuthFilePath();
            if (path == null) {
                throw new SourceUnavailableException(getSource(),
                    String.format("no auth file is configured and %s is not set.", EnvironmentSettings.AUTH_LOCATION));
            }
            if (!Files.isRegularFile(path)) {
                throw new SourceUnavailableException(getSource(), String.format("auth file '%s' does not exist.", path));
            }
            return true;
        });
    }

    @Override
    protected TokenCredential createCredential(AzureEnvironment env) {
        final Path path = getAuthFilePath();
        final AuthFile authFile = readAuthFile(path);
        final ServicePrincipalConfiguration config = authFile.toServicePrincipalConfiguration();
        if (StringUtils.isBlank(config.getAuthorityHost())) {
            config.setAuthorityHost(env.getActiveDirectoryEndpoint());
        }
        try {
            ValidationUtil.validateServicePrincipal(config);
        } catch (InvalidConfigurationException e) {
            throw new SourceUnavailableException(getSource(), String.format("invalid auth file '%s': %s", path, e.getMessage()));
        }
        LOGGER.verbose("Using auth file '{}' of client '{}' for subscription '{}'.", path, authFile.getClientId(), authFile.getSubscriptionId());
        return ServicePrincipalCredentials.createCredential(config);
    }

    AuthFile readAuthFile(Path path) {
        final byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new SourceUnavailableException(getSource(), String.format("cannot read auth file '%s'.", path), e);
        }
        try {
            final AuthFile authFile = MAPPER.readValue(decode(content), AuthFile.class);
            if (authFile == null) {
                throw new SourceUnavailableException(getSource(), String.format("auth file '%s' is empty.", path));
            }
            return authFile;
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(getSource(), String.format("auth file '%s' is malformed.", path), e);
        }
    }

    /**
     * Decodes the file honoring a UTF-8 or UTF-16 byte order mark; files without one are read as UTF-8.
     */
    static String decode(byte[] content) {
        if (startsWith(content, 0xEF, 0xBB, 0xBF)) {
            return decode(content, 3, StandardCharsets.UTF_8);
        } else if (startsWith(content, 0xFE, 0xFF)) {
            return decode(content, 2, StandardCharsets.UTF_16BE);
        } else if (startsWith(content, 0xFF, 0xFE)) {
            return decode(content, 2, StandardCharsets.UTF_16LE);
        }
        return new String(content, StandardCharsets.UTF_8);
    }

    private static String decode(byte[] content, int offset, Charset charset) {
        return new String(Arrays.copyOfRange(content, offset, content.length), charset);
    }

    private static boolean startsWith(byte[] content, int... bom) {
        if (content.length < bom.length) {
            return false;
        }
        for (int i = 0; i < bom.length; i++) {
            if ((content[i] & 0xFF) != bom[i]) {
                return false;
            }
        }
        return true;
    }
}
