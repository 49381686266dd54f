package com.terralint.core.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SourceDiscovery}.
 */
class SourceDiscoveryTest {

    @TempDir
    Path tempDir;

    private Path touch(String relativePath) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
        return file;
    }

    @Test
    void discover_returnsSortedTerraformFilesAndSkipsHiddenDirectories() throws IOException {
        // Given
        Path variables = touch("stack/variables.tf");
        Path main = touch("stack/main.tf");
        Path values = touch("stack/terraform.tfvars");
        touch("stack/README.md");
        touch("stack/.terraform/modules/vpc/main.tf");

        // When
        List<Path> files = new SourceDiscovery().discover(tempDir);

        // Then
        assertThat(files).containsExactly(main, values, variables);
    }

    @Test
    void discover_withExcludedDirectoryName_skipsSubtree() throws IOException {
        // Given
        Path kept = touch("stack/main.tf");
        touch("examples/demo/main.tf");
        touch("stack/examples/main.tf");

        // When
        List<Path> files = new SourceDiscovery(List.of(), List.of("examples")).discover(tempDir);

        // Then
        assertThat(files).containsExactly(kept);
    }

    @Test
    void discover_withGlobs_filtersRelativePaths() throws IOException {
        // Given
        Path network = touch("modules/network/main.tf");
        touch("modules/network/legacy.tf");
        touch("stack/main.tf");

        // When
        List<Path> files = new SourceDiscovery(List.of("modules/**"), List.of("**/legacy.tf")).discover(tempDir);

        // Then
        assertThat(files).containsExactly(network);
    }

    @Test
    void discover_withSingleFile_returnsItWhenTerraform() throws IOException {
        // Given
        Path main = touch("main.tf");
        Path readme = touch("README.md");

        // When / Then
        assertThat(new SourceDiscovery().discover(main)).containsExactly(main);
        assertThat(new SourceDiscovery().discover(readme)).isEmpty();
    }

    @Test
    void discover_withMissingPath_throwsIOException() {
        Path missing = tempDir.resolve("missing");

        assertThatThrownBy(() -> new SourceDiscovery().discover(missing))
            .isInstanceOf(IOException.class)
            .hasMessage("Path does not exist: " + missing);
    }
}
