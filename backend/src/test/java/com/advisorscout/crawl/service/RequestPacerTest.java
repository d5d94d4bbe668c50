package com.advisorscout.crawl.service;

import com.advisorscout.crawl.model.DelayRange;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestPacerTest {

    @Test
    void delaysStayWithinConfiguredRange() {
        RequestPacer pacer = new RequestPacer(new DelayRange(0.3, 0.8));
        for (int i = 0; i < 500; i++) {
            assertThat(pacer.nextDelayMillis()).isBetween(300L, 800L);
        }
    }

    @Test
    void zeroMaximumDisablesPacing() {
        RequestPacer pacer = new RequestPacer(DelayRange.NONE);
        assertThat(pacer.nextDelayMillis()).isZero();
        assertThat(pacer.pause("https://example.com/a")).isTrue();
    }

    @Test
    void equalBoundsGiveFixedDelay() {
        assertThat(new RequestPacer(new DelayRange(0.25, 0.25)).nextDelayMillis()).isEqualTo(250L);
    }

    @Test
    void interruptedPauseReportsFalse() {
        RequestPacer pacer = new RequestPacer(new DelayRange(1, 1));
        Thread.currentThread().interrupt();
        try {
            assertThat(pacer.pause("https://example.com/a")).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void inconsistentRangeIsRejected() {
        assertThatThrownBy(() -> new DelayRange(2, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DelayRange(-1, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonFiniteRangeIsRejected() {
        assertThatThrownBy(() -> new DelayRange(Double.NaN, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DelayRange(0.3, Double.POSITIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);
    }
}
