package com.terralint.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("terralint.yaml");
        Files.writeString(configFile, """
            rules:
              categories: [ST, IO]
              excluded: [ST.009]
              severities: [error]

            paths:
              include: ["**/*.tf"]
              exclude: [examples]

            files:
              variables: "inputs.tf"

            naming:
              instanceName: this

            variables:
              allowList: [token]

            versions:
              providers: [huaweicloud, aws]
              knownReleases:
                huaweicloud: ["1.60.0", "1.61.0"]
              minimumWorking:
                huaweicloud: "1.60.0"

            execution:
              parallelism: 4

            report:
              format: both
              directory: "./reports"
            """);

        LintConfig config = ConfigLoader.load(configFile);

        assertThat(config.rules().categories()).containsExactly("ST", "IO");
        assertThat(config.rules().excluded()).containsExactly("ST.009");
        assertThat(config.rules().severities()).containsExactly("error");
        assertThat(config.paths().include()).containsExactly("**/*.tf");
        assertThat(config.paths().exclude()).containsExactly("examples");
        assertThat(config.files().variables()).isEqualTo("inputs.tf");
        assertThat(config.files().main()).isEqualTo("main.tf");
        assertThat(config.naming().instanceName()).isEqualTo("this");
        assertThat(config.variables().allowList()).containsExactly("token");
        assertThat(config.variables().allowPrefixes()).containsExactly("region");
        assertThat(config.versions().providers()).containsExactly("huaweicloud", "aws");
        assertThat(config.versions().knownReleases()).containsKey("huaweicloud");
        assertThat(config.versions().minimumWorking()).containsEntry("huaweicloud", "1.60.0");
        assertThat(config.execution().parallelism()).isEqualTo(4);
        assertThat(config.report().format()).isEqualTo("both");
        assertThat(config.report().directory()).isEqualTo("./reports");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("terralint.yaml");
        Files.writeString(configFile, """
            naming:
              instanceName: main
            unknownSection:
              ignored: true
            """);

        LintConfig config = ConfigLoader.load(configFile);

        assertThat(config.naming().instanceName()).isEqualTo("main");
        assertThat(config.rules().categories()).isEmpty();
        assertThat(config.files().tfvars()).isEqualTo("terraform.tfvars");
        assertThat(config.variables().allowList()).isEqualTo(LintConfig.VariablesConfig.DEFAULT_ALLOW_LIST);
        assertThat(config.versions().providers()).isEmpty();
        assertThat(config.execution().parallelism()).isZero();
        assertThat(config.report().format()).isEqualTo("text");
        assertThat(config.report().directory()).isNull();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        LintConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(LintConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("terralint.yaml");
        Files.writeString(configFile, "rules: [unclosed");

        LintConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(LintConfig.defaults());
    }

    @Test
    void loadStrict_invalidYaml_throwsConfigurationException() throws IOException {
        Path configFile = tempDir.resolve("terralint.yaml");
        Files.writeString(configFile, "rules: [unclosed");

        assertThatThrownBy(() -> ConfigLoader.loadStrict(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("Failed to parse configuration file");
    }

    @Test
    void loadStrict_missingFile_throwsConfigurationException() {
        Path missing = tempDir.resolve("missing.yaml");

        assertThatThrownBy(() -> ConfigLoader.loadStrict(missing))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Configuration file not found or not readable: " + missing);
    }
}
