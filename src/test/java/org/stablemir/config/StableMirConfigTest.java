package org.stablemir.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stablemir.bridge.intern.InternStrategy;
import org.stablemir.lint.LintLevel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for StableMirConfig: defaults from reference.conf and overrides on top of them.
 */
@Tag("unit")
class StableMirConfigTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("stablemir.interning.strategy");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void defaults_useLinearInterningAndDenyTheReadLint() {
        StableMirConfig config = StableMirConfig.defaults();

        assertEquals(InternStrategy.LINEAR, config.internStrategy());
        assertEquals(LintLevel.DENY, config.lintLevel("read_zero_byte_vec", LintLevel.ALLOW));
    }

    @Test
    void unknownLint_fallsBackToBuiltinLevel() {
        StableMirConfig config = StableMirConfig.defaults();

        assertEquals(LintLevel.WARN, config.lintLevel("some_other_lint", LintLevel.WARN));
    }

    @Test
    void explicitStrategy_overridesDefault() {
        StableMirConfig config = StableMirConfig.from(
                ConfigFactory.parseString("stablemir.interning.strategy = hash-consing"));

        assertEquals(InternStrategy.HASH_CONSING, config.internStrategy());
    }

    @Test
    @DisplayName("System property should override the default strategy")
    void load_systemPropertyOverridesStrategy() {
        System.setProperty("stablemir.interning.strategy", "hash-consing");
        ConfigFactory.invalidateCaches();

        assertEquals(InternStrategy.HASH_CONSING, StableMirConfig.load().internStrategy());
    }

    @Test
    void unknownStrategy_isReportedAgainstItsPath() {
        assertThatThrownBy(() -> StableMirConfig.from(
                ConfigFactory.parseString("stablemir.interning.strategy = treap")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("stablemir.interning.strategy")
                .hasMessageContaining("treap");
    }

    @Test
    void unknownLintLevel_isReportedAgainstItsPath() {
        assertThatThrownBy(() -> StableMirConfig.from(
                ConfigFactory.parseString("stablemir.lints.read-zero-byte-vec = forbid")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("read-zero-byte-vec")
                .hasMessageContaining("deny, warn, allow");
    }

    @Test
    @DisplayName("Hyphenated and underscored lint names are the same lint")
    void lintNames_areNormalized() {
        StableMirConfig hyphenated = StableMirConfig.from(
                ConfigFactory.parseString("stablemir.lints.read-zero-byte-vec = warn"));
        StableMirConfig underscored = StableMirConfig.from(
                ConfigFactory.parseString("stablemir.lints.read_zero_byte_vec = allow"));

        assertEquals(LintLevel.WARN, hyphenated.lintLevel("read_zero_byte_vec", LintLevel.DENY));
        assertEquals(LintLevel.WARN, hyphenated.lintLevel("read-zero-byte-vec", LintLevel.DENY));
        assertThat(underscored.lintLevel("read_zero_byte_vec", LintLevel.DENY)).isEqualTo(LintLevel.ALLOW);
    }
}
