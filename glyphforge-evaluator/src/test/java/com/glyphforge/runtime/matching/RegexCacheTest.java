package com.glyphforge.runtime.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class RegexCacheTest {

    @Test
    @DisplayName("Should compile each expression once")
    void testCaching() {
        RegexCache cache = new RegexCache();

        Pattern first = cache.get("[a-z]+").orElseThrow();
        Pattern second = cache.get("[a-z]+").orElseThrow();

        assertThat(second).isSameAs(first);
        assertThat(cache.hitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cache invalid expressions as absent")
    void testInvalidExpression() {
        RegexCache cache = new RegexCache();

        assertThat(cache.get("(")).isEmpty();
        assertThat(cache.get("(")).isEmpty();
        assertThat(cache.hitCount()).isEqualTo(1);
    }
}
