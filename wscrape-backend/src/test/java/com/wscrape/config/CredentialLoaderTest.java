package com.wscrape.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialLoaderTest {

    @TempDir
    Path tempDir;

    private final CredentialLoader loader = new CredentialLoader();

    @Test
    @DisplayName("Should read user and pass from a credential file")
    void load_ValidFile_ReturnsLogin() throws IOException {
        Path file = write("{\"user\": \"myusername\", \"pass\": \"mypassword\"}");

        Login login = loader.load(file);

        assertThat(login.getUser()).isEqualTo("myusername");
        assertThat(login.getPass()).isEqualTo("mypassword");
    }

    @Test
    @DisplayName("Should not expose the password in toString")
    void toString_HidesPassword() {
        assertThat(new Login("u", "secret").toString()).doesNotContain("secret");
    }

    @Test
    @DisplayName("Should reject a file without a pass field")
    void load_MissingField_Throws() throws IOException {
        Path file = write("{\"user\": \"myusername\"}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(file.toString());
    }

    @Test
    @DisplayName("Should reject a null user")
    void load_NullUser_Throws() throws IOException {
        Path file = write("{\"user\": null, \"pass\": \"p\"}");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should reject unknown fields")
    void load_UnknownField_Throws() throws IOException {
        Path file = write("{\"user\": \"u\", \"pass\": \"p\", \"host\": \"h\"}");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void load_MalformedJson_Throws() throws IOException {
        Path file = write("{\"user\": \"u\", ");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should reject a missing file")
    void load_MissingFile_Throws() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    private Path write(String json) throws IOException {
        Path file = Files.createTempFile(tempDir, "login", ".json");
        Files.writeString(file, json);
        return file;
    }
}
