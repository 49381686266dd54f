package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link DirectoryNamingRule} and {@link FileNamingRule}.
 */
class NamingRulesTest extends RuleTestBase {

    private static final String LOCALS = "locals {\n  name = \"web\"\n}\n";

    @Test
    void directoryNaming_withUnderscore_reportsDirectory() throws IOException {
        // Given
        createFile("modules/my_vpc/main.tf", LOCALS);
        createFile("modules/web-app/main.tf", LOCALS);

        // When
        List<Violation> violations = check(new DirectoryNamingRule());

        // Then
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).file()).isEqualTo(tempDir.resolve("modules/my_vpc"));
        assertThat(violations.get(0).line()).isZero();
        assertThat(violations.get(0).message()).startsWith("Directory name 'my_vpc' does not follow naming convention");
    }

    @Test
    void directoryNaming_isValid_followsConvention() {
        assertThat(DirectoryNamingRule.isValid("web-app")).isTrue();
        assertThat(DirectoryNamingRule.isValid("ecs")).isTrue();
        assertThat(DirectoryNamingRule.isValid("web--app")).isFalse();
        assertThat(DirectoryNamingRule.isValid("app2")).isFalse();
        assertThat(DirectoryNamingRule.isValid("-app")).isFalse();
        assertThat(DirectoryNamingRule.isValid("a")).isFalse();
    }

    @Test
    void fileNaming_withHyphenAndTrailingDigit_reportsBoth() throws IOException {
        // Given
        createFile("network/my-file.tf", LOCALS);
        createFile("network/subnet_2.tf", LOCALS);
        createFile("network/main.tf", LOCALS);

        // When
        List<Violation> violations = check(new FileNamingRule());

        // Then
        assertThat(violations).extracting(v -> v.file().getFileName().toString())
            .containsExactlyInAnyOrder("my-file.tf", "subnet_2.tf");
        assertThat(violations).allSatisfy(v -> assertThat(v.line()).isZero());
    }

    @Test
    void fileNaming_withAutoTfvars_skipsFile() throws IOException {
        // Given
        createFile("network/prod-1.auto.tfvars", "name = \"web\"\n");
        createFile("network/terraform.tfvars", "name = \"web\"\n");

        // When / Then
        assertThat(check(new FileNamingRule())).isEmpty();
    }
}
