package org.nibble.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AssemblerSettings}.
 */
@Tag("unit")
class AssemblerSettingsTest {

    @Test
    void referenceDefaultsAreLoaded() {
        // Given
        final Config config = ConfigFactory.load();

        // When
        final AssemblerSettings settings = AssemblerSettings.from(config);

        // Then
        assertThat(settings.tabWidth()).isEqualTo(4);
        assertThat(settings.outputExtension()).isEqualTo("bin");
        assertThat(settings.hexDump()).isFalse();
        assertThat(settings.hexDumpBytesPerLine()).isEqualTo(16);
    }

    @Test
    void overridesTakePrecedenceOverDefaults() {
        final Config config = ConfigFactory.parseString("""
            assembler {
              tab-width = 8
              output-extension = ".img"
              hex-dump = true
            }
            """).withFallback(ConfigFactory.load());

        final AssemblerSettings settings = AssemblerSettings.from(config);

        assertThat(settings.tabWidth()).isEqualTo(8);
        assertThat(settings.outputExtension()).isEqualTo("img");
        assertThat(settings.hexDump()).isTrue();
        assertThat(settings.hexDumpBytesPerLine()).isEqualTo(16);
    }

    @Test
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> new AssemblerSettings(0, "bin", false, 16))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AssemblerSettings(4, "a/b", false, 16))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssemblerSettings.from(ConfigFactory.parseString("assembler.tab-width = wide")))
                .isInstanceOf(ConfigException.class);
    }
}
