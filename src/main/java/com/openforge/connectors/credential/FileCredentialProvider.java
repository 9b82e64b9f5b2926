package com.openforge.connectors.credential;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Docker-secrets style lookup: {@code <directory>/<ENV_VAR>}, first line only.
 */
@Slf4j
public class FileCredentialProvider implements CredentialProvider {

    private final Path directory;

    public FileCredentialProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public CredentialOrigin origin() {
        return CredentialOrigin.FILE;
    }

    @Override
    public String describe(CredentialSpec spec) {
        return directory == null ? "file(disabled)" : "file:" + directory.resolve(spec.envVar());
    }

    @Override
    public Optional<String> lookup(CredentialSpec spec) {
        if (directory == null) {
            return Optional.empty();
        }
        Path file = directory.resolve(spec.envVar());
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return Optional.ofNullable(reader.readLine());
        } catch (IOException e) {
            // An unreadable file is treated like a missing one so later sources still get a chance.
            log.warn("[Credentials] Cannot read credential file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
