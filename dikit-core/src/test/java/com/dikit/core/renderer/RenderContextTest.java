package com.dikit.core.renderer;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RenderContext}.
 */
class RenderContextTest {

    @Test
    void getBooleanSetting_parsesValueOrFallsBack() {
        RenderContext context = new RenderContext(Path.of("out"), Map.of("console.colors", "false"));

        assertThat(context.getBooleanSetting("console.colors", true)).isFalse();
        assertThat(context.getBooleanSetting("console.showHeaders", true)).isTrue();
    }

    @Test
    void getSettingOrDefault_returnsDefaultForMissingKey() {
        RenderContext context = RenderContext.of(Path.of("out"));

        assertThat(context.settings()).isEmpty();
        assertThat(context.getSettingOrDefault("missing", "fallback")).isEqualTo("fallback");
    }
}
