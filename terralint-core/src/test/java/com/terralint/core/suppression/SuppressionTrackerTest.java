package com.terralint.core.suppression;

import com.terralint.core.model.SourceFile;
import com.terralint.core.model.SuppressionRange;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link SuppressionTracker}.
 */
class SuppressionTrackerTest {

    private final SuppressionTracker tracker = new SuppressionTracker();

    private SuppressionMap scan(String content) {
        return tracker.scan(SourceFile.of(Path.of("main.tf"), content));
    }

    @Test
    void scan_withDisableAndEnable_coversLinesBetweenInclusively() {
        // Given
        SuppressionMap map = scan("""
            # ST.001 Disable
            resource "aws_vpc" "bad" {
            }
            # ST.001 Enable
            resource "aws_vpc" "worse" {
            }
            """);

        // Then
        assertThat(map.rangesFor("ST.001")).extracting(SuppressionRange::startLine, SuppressionRange::endLine)
            .containsExactly(tuple(2, 4));
        assertThat(map.isSuppressed("ST.001", 1)).isFalse();
        assertThat(map.isSuppressed("ST.001", 2)).isTrue();
        assertThat(map.isSuppressed("ST.001", 4)).isTrue();
        assertThat(map.isSuppressed("ST.001", 5)).isFalse();
        assertThat(map.isSuppressed("ST.002", 2)).isFalse();
    }

    @Test
    void scan_withUnclosedDisable_runsToEndOfFile() {
        // Given
        SuppressionMap map = scan("""
            locals {
              # IO.004 Disable
              name = "web"
            }
            """);

        // Then
        assertThat(map.rangesFor("IO.004")).singleElement().satisfies(range -> {
            assertThat(range.startLine()).isEqualTo(3);
            assertThat(range.isOpenEnded()).isTrue();
        });
        assertThat(map.isSuppressed("IO.004", 10_000)).isTrue();
    }

    @Test
    void scan_withRepeatedDisable_keepsFirstStart() {
        // Given
        SuppressionMap map = scan("""
            # ST.011 Disable
            a = 1
            # ST.011 Disable
            b = 2
            # ST.011 Enable
            """);

        // Then
        assertThat(map.rangesFor("ST.011")).singleElement().satisfies(range -> {
            assertThat(range.startLine()).isEqualTo(2);
            assertThat(range.endLine()).isEqualTo(5);
        });
    }

    @Test
    void scan_withEnableWithoutDisable_isIgnored() {
        // When
        SuppressionMap map = scan("# ST.001 Enable\na = 1\n");

        // Then
        assertThat(map.isEmpty()).isTrue();
        assertThat(map.malformed()).isEmpty();
    }

    @Test
    void scan_withMalformedDirectives_recordsThem() {
        // Given: wrong case, trailing text and a lowercase category
        SuppressionMap map = scan("""
            # ST.001 disable
            # ST.001 Disable please
            # st.001 Disable
            a = 1 # ST.001 Disable
            """);

        // Then
        assertThat(map.isEmpty()).isTrue();
        assertThat(map.malformed()).extracting(SuppressionMap.MalformedDirective::line)
            .containsExactly(1, 2, 3, 4);
    }
}
