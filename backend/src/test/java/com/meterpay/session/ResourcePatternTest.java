package com.meterpay.session;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourcePatternTest {

    @Test
    void wildcardOrBlankPattern_matchesEverything() {
        assertThat(ResourcePattern.matches("*", "/api/weather/today")).isTrue();
        assertThat(ResourcePattern.matches(null, "anything")).isTrue();
        assertThat(ResourcePattern.matches("  ", "anything")).isTrue();
    }

    @Test
    void trailingStar_matchesNestedPaths() {
        assertThat(ResourcePattern.matches("api/weather/*", "/api/weather/today")).isTrue();
        assertThat(ResourcePattern.matches("/api/weather/*", "api/weather/forecast/7d")).isTrue();
        assertThat(ResourcePattern.matches("api/weather/*", "/api/stocks/today")).isFalse();
    }

    @Test
    void namedSegment_matchesExactlyOneSegment() {
        assertThat(ResourcePattern.matches("agent/{id}/run", "agent/summarizer/run")).isTrue();
        assertThat(ResourcePattern.matches("agent/{id}/run", "agent/a/b/run")).isFalse();
    }

    @Test
    void regexCharacters_areLiteral() {
        assertThat(ResourcePattern.matches("api/v1.0/price", "api/v1.0/price")).isTrue();
        assertThat(ResourcePattern.matches("api/v1.0/price", "api/v1x0/price")).isFalse();
        assertThat(ResourcePattern.matches("data/(a|b)", "data/(a|b)")).isTrue();
    }

    @Test
    void nullResource_onlyMatchesOpenPattern() {
        assertThat(ResourcePattern.matches("api/*", null)).isFalse();
    }

    @Test
    void forService_buildsLowercasePrefixPattern() {
        assertThat(ResourcePattern.forService("API", "weather-svc")).isEqualTo("api/weather-svc/*");
        assertThat(ResourcePattern.matches(ResourcePattern.forService("API", "weather-svc"), "api/weather-svc/today")).isTrue();
    }
}
