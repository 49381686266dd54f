package com.terralint.core.rule.impl.security;

import com.terralint.core.model.Violation;
import com.terralint.core.rule.RuleTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link VersionCompatibilityRule}.
 */
class VersionCompatibilityRuleTest extends RuleTestBase {

    private final VersionCompatibilityRule rule = new VersionCompatibilityRule();

    @BeforeEach
    void setUp() throws IOException {
        createFile("variables.tf", """
            variable "password" {
              type      = string
              sensitive = true
              nullable  = false
            }
            """);
    }

    @Test
    void check_withDeclaredVersionBelowFeatures_namesOffendingFeatures() throws IOException {
        // Given
        createFile("providers.tf", """
            terraform {
              required_version = ">= 0.12.0"
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).file().getFileName().toString()).isEqualTo("providers.tf");
        assertThat(violations.get(0).line()).isEqualTo(2);
        assertThat(violations.get(0).message()).isEqualTo(
            "Declared version '>= 0.12.0' is too low. Required: '>= 1.1.0' based on features "
                + "'sensitive', 'nullable' used");
    }

    @Test
    void check_withSingleOffendingFeature_usesSingularWording() throws IOException {
        // Given
        createFile("providers.tf", """
            terraform {
              required_version = ">= 0.14.0"
            }
            """);

        // When
        List<Violation> violations = check(rule);

        // Then
        assertThat(violations).extracting(Violation::message).containsExactly(
            "Declared version '>= 0.14.0' is too low. Required: '>= 1.1.0' based on feature 'nullable' used");
    }

    @Test
    void check_withSufficientVersion_reportsNothing() throws IOException {
        // Given
        createFile("providers.tf", """
            terraform {
              required_version = ">= 1.3.0"
            }
            """);

        // When / Then
        assertThat(check(rule)).isEmpty();
    }

    @Test
    void check_withoutProvidersFile_doesNotApply() throws IOException {
        // When / Then
        assertThat(check(rule)).isEmpty();
    }
}
