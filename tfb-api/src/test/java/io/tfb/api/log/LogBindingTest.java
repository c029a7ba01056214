package io.tfb.api.log;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogBindingTest {

    @Test
    void appliedShouldHaveNoReason() {
        var binding = LogBinding.applied();

        assertThat(binding.isApplied()).isTrue();
        assertThat(binding.isSkipped()).isFalse();
        assertThat(binding.status()).isEqualTo(LogBinding.Status.APPLIED);
        assertThat(binding.reason()).isEmpty();
    }

    @Test
    void skippedShouldKeepReason() {
        var binding = LogBinding.skipped("no log directory configured");

        assertThat(binding.isSkipped()).isTrue();
        assertThat(binding.reason()).isEqualTo("no log directory configured");
    }

    @Test
    void skippedShouldRequireReason() {
        assertThatThrownBy(() -> LogBinding.skipped(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
