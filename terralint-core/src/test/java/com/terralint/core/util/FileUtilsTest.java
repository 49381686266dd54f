package com.terralint.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void readString_withUtf8File_returnsContent() throws IOException {
        Path file = tempDir.resolve("main.tf");
        Files.writeString(file, "# Réseau\n", StandardCharsets.UTF_8);

        assertThat(FileUtils.readString(file)).isEqualTo("# Réseau\n");
    }

    @Test
    void readString_withLatin1File_fallsBack() throws IOException {
        Path file = tempDir.resolve("main.tf");
        Files.write(file, new byte[] {'#', ' ', (byte) 0xE9, '\n'});

        assertThat(FileUtils.readString(file)).isEqualTo("# é\n");
    }

    @Test
    void getExtensionAndStem_useLastAndFirstDot() {
        Path file = Path.of("envs/prod.auto.tfvars");

        assertThat(FileUtils.getExtension(file)).isEqualTo("tfvars");
        assertThat(FileUtils.getStem(file)).isEqualTo("prod");
        assertThat(FileUtils.getExtension(Path.of(".terraform"))).isEmpty();
    }

    @Test
    void fileKinds_areDetectedByExtension() {
        assertThat(FileUtils.isConfigurationFile(Path.of("main.tf"))).isTrue();
        assertThat(FileUtils.isConfigurationFile(Path.of("main.tf.json"))).isFalse();
        assertThat(FileUtils.isVariableValuesFile(Path.of("terraform.tfvars"))).isTrue();
        assertThat(FileUtils.isHidden(Path.of("modules/.terraform"))).isTrue();
    }

    @Test
    void globMatcher_matchesRelativePaths() {
        assertThat(FileUtils.globMatcher("modules/**").matches(Path.of("modules/vpc/main.tf"))).isTrue();
        assertThat(FileUtils.globMatcher("modules/**").matches(Path.of("main.tf"))).isFalse();
    }
}
