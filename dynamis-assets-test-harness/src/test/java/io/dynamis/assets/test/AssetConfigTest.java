package io.dynamis.assets.test;

import io.dynamis.assets.api.*;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

class AssetConfigTest {

    @Test
    void wellKnownKeysHaveDefaults() {
        AssetConfig config = AssetConfig.empty();
        assertThat(config.loadKey()).isEqualTo(AssetConstants.LOAD_ON_DEMAND);
        assertThat(config.priority()).isEqualTo(AssetConstants.DEFAULT_PRIORITY);
    }

    @Test
    void missingFileThrows() {
        assertThatThrownBy(() -> AssetConfig.empty().file())
            .isInstanceOf(AssetConfigurationException.class)
            .hasMessageContaining(AssetConstants.KEY_FILE);
    }

    @Test
    void fileAcceptsPathOrString() {
        assertThat(AssetConfig.of(Map.of("file", "/tmp/a.pcm")).file()).isEqualTo(Path.of("/tmp/a.pcm"));
        assertThat(AssetConfig.of(Map.of("file", Path.of("b.pcm"))).file()).isEqualTo(Path.of("b.pcm"));
    }

    @Test
    void getIntCoercesNumericStrings() {
        AssetConfig config = AssetConfig.of(Map.of("priority", " 12 ", "channels", 2L));
        assertThat(config.priority()).isEqualTo(12);
        assertThat(config.getInt("channels", 0)).isEqualTo(2);
        assertThat(config.getInt("absent", 9)).isEqualTo(9);
    }

    @Test
    void nonIntegerValueThrows() {
        AssetConfig config = AssetConfig.of(Map.of("priority", "high"));
        assertThatThrownBy(config::priority).isInstanceOf(AssetConfigurationException.class);
    }

    @Test
    void nullValuesAreDropped() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("load", null);
        raw.put("priority", 3);
        AssetConfig config = AssetConfig.of(raw);
        assertThat(config.has("load")).isFalse();
        assertThat(config.loadKey()).isEqualTo(AssetConstants.LOAD_ON_DEMAND);
    }

    @Test
    void withReturnsModifiedCopy() {
        AssetConfig base = AssetConfig.of(Map.of("load", "preload"));
        AssetConfig changed = base.with("load", "attract_start");
        assertThat(base.loadKey()).isEqualTo("preload");
        assertThat(changed.loadKey()).isEqualTo("attract_start");
    }

    @Test
    void mapViewIsUnmodifiable() {
        AssetConfig config = AssetConfig.of(Map.of("load", "preload"));
        assertThatThrownBy(() -> config.asMap().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void modeStartKeyAppendsSuffix() {
        assertThat(AssetConstants.modeStartKey("attract")).isEqualTo("attract_start");
    }
}
