package com.refgraph.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GlobMatcher}.
 */
class GlobMatcherTest {

    @ParameterizedTest
    @CsvSource({
        "**/*.xml, top.xml, true",
        "**/*.xml, panels/vision/main.xml, true",
        "**/*.xml, scripts/libs/a.ctl, false",
        "panels/vision/**/*.xml, panels/vision/main.xml, true",
        "panels/vision/**/*.xml, panels/vision/a/b/main.xml, true",
        "panels/vision/**/*.xml, panels/visionary/main.xml, false",
        "panels/*.xml, panels/main.xml, true",
        "panels/*.xml, panels/vision/main.xml, false",
        "panels/objects/objects_A/**, panels/objects/objects_A/x.xml, true"
    })
    void matches_globPatterns(String pattern, String key, boolean expected) {
        assertThat(GlobMatcher.of(pattern).matches(key)).isEqualTo(expected);
    }

    @Test
    void matches_anyPattern_matchesKey() {
        GlobMatcher matcher = GlobMatcher.of(List.of("panels/**", "scripts/**"));

        assertThat(matcher.matches("scripts/libs/std/Struct.ctl")).isTrue();
        assertThat(matcher.matches("images/logo.png")).isFalse();
    }

    @Test
    void matches_noPatterns_matchesNothing() {
        GlobMatcher matcher = GlobMatcher.of(List.of());

        assertThat(matcher.isEmpty()).isTrue();
        assertThat(matcher.matches("panels/main.xml")).isFalse();
    }
}
