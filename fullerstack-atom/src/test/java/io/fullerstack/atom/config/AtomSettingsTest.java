package io.fullerstack.atom.config;

import io.fullerstack.atom.UnhandledFailurePolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtomSettingsTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(AtomSettings.UNHANDLED_POLICY_KEY);
        System.clearProperty(AtomSettings.FAILURE_CAPACITY_KEY);
    }

    @Test
    void defaultsComeFromAtomProperties() {
        AtomSettings settings = AtomSettings.defaults();

        assertThat(settings.isFairLock()).isFalse();
        assertThat(settings.getUnhandledFailurePolicy()).isEqualTo(UnhandledFailurePolicy.DISCARD);
        assertThat(settings.getFailureCapacity()).isEqualTo(256);
    }

    @Test
    void overriddenValuesAreApplied() {
        System.setProperty(AtomSettings.UNHANDLED_POLICY_KEY, "COLLECT");
        System.setProperty(AtomSettings.FAILURE_CAPACITY_KEY, "4");

        AtomSettings settings = AtomSettings.from(AtomConfig.global());

        assertThat(settings.getUnhandledFailurePolicy()).isEqualTo(UnhandledFailurePolicy.COLLECT);
        assertThat(settings.getFailureCapacity()).isEqualTo(4);
    }

    @Test
    void policyIsCaseInsensitive() {
        System.setProperty(AtomSettings.UNHANDLED_POLICY_KEY, "log");

        assertThat(AtomSettings.defaults().getUnhandledFailurePolicy()).isEqualTo(UnhandledFailurePolicy.LOG);
    }

    @Test
    void nonPositiveCapacityInConfigIsRejected() {
        System.setProperty(AtomSettings.FAILURE_CAPACITY_KEY, "0");

        assertThatThrownBy(AtomSettings::defaults)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining(AtomSettings.FAILURE_CAPACITY_KEY);
    }

    @Test
    void toBuilderOverridesSingleValues() {
        AtomSettings settings = AtomSettings.defaults().toBuilder()
            .fairLock(true)
            .build();

        assertThat(settings.isFairLock()).isTrue();
        assertThat(settings.getFailureCapacity()).isEqualTo(256);
    }

    @Test
    void builderValidatesValues() {
        assertThatThrownBy(() -> AtomSettings.builder()
            .unhandledFailurePolicy(UnhandledFailurePolicy.LOG)
            .failureCapacity(-1)
            .build())
            .isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> AtomSettings.builder().failureCapacity(1).build())
            .isInstanceOf(NullPointerException.class);
    }
}
