package com.example.paylog.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncRetryPropertiesTest {

    @Test
    void defaultsDoubleFromOneSecond() {
        SyncRetryProperties retry = new SyncRetryProperties();

        assertThat(retry.getMaxAttempts()).isEqualTo(3);
        assertThat(retry.backoffBeforeAttempt(1)).isZero();
        assertThat(retry.backoffBeforeAttempt(2)).isEqualTo(1000L);
        assertThat(retry.backoffBeforeAttempt(3)).isEqualTo(2000L);
        assertThat(retry.backoffBeforeAttempt(4)).isEqualTo(4000L);
    }

    @Test
    void pauseIsCappedAndNeverOverflows() {
        SyncRetryProperties retry = new SyncRetryProperties();
        retry.setMaxDelayMs(5000L);

        assertThat(retry.backoffBeforeAttempt(5)).isEqualTo(5000L);
        assertThat(retry.backoffBeforeAttempt(70)).isEqualTo(5000L);
        assertThat(retry.backoffBeforeAttempt(Integer.MAX_VALUE)).isEqualTo(5000L);
    }

    @Test
    void jitterStaysWithinFactor() {
        SyncRetryProperties retry = new SyncRetryProperties(1000L, 0.2, 3);

        for (int i = 0; i < 100; i++) {
            assertThat(retry.backoffBeforeAttempt(3)).isBetween(1600L, 2400L);
        }
    }

    @Test
    void atLeastOneAttempt() {
        assertThatThrownBy(() -> new SyncRetryProperties(1000L, 0.0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-attempts");
        assertThatThrownBy(() -> new SyncRetryProperties().setMaxAttempts(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
