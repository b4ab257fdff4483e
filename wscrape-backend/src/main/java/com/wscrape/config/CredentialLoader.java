package com.wscrape.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link Login} credential files.
 */
public class CredentialLoader {

    private final ObjectMapper objectMapper;

    public CredentialLoader() {
        this(new ObjectMapper());
    }

    public CredentialLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper")
                .copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES);
    }

    /**
     * Load credentials from a JSON file.
     *
     * @param file path to a {@code {"user": ..., "pass": ...}} document
     * @return credentials
     * @throws ConfigurationException if the file is missing, malformed or lacks a field
     */
    public Login load(Path file) {
        if (file == null) {
            throw new ConfigurationException("Credential file path is required");
        }
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Credential file not found: " + file);
        }

        Login login;
        try (InputStream is = Files.newInputStream(file)) {
            login = objectMapper.readValue(is, Login.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read credential file: " + file, e);
        }

        if (login == null) {
            throw new ConfigurationException("Credential file is empty: " + file);
        }
        if (login.getUser() == null || login.getUser().isBlank()) {
            throw new ConfigurationException("Credential file has no user: " + file);
        }
        if (login.getPass() == null) {
            throw new ConfigurationException("Credential file has no pass: " + file);
        }
        return login;
    }
}
