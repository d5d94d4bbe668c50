package com.advisorscout.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoutPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        ScoutProperties properties = new ScoutProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void timeoutsAreClamped() {
        ScoutProperties properties = new ScoutProperties();
        properties.setConnectTimeoutSeconds(0);
        properties.setPageTimeoutSeconds(-5);
        properties.getSitemap().setTimeoutSeconds(0);
        properties.getFetch().setProgressLogInterval(0);
        assertEquals(1, properties.getConnectTimeoutSeconds());
        assertEquals(1, properties.getPageTimeoutSeconds());
        assertEquals(1, properties.getSitemap().getTimeoutSeconds());
        assertEquals(1, properties.getFetch().getProgressLogInterval());
    }

    @Test
    void defaultsAreValid() {
        ScoutProperties properties = new ScoutProperties();
        assertThatCode(properties::validate).doesNotThrowAnyException();
        assertThat(properties.getSitemap().getSeeds()).containsExactly("https://www.dvag.de/sitemap-index.xml");
        assertThat(properties.getFetch().delayRange().minSeconds()).isEqualTo(0.3);
        assertThat(properties.getFetch().delayRange().maxSeconds()).isEqualTo(0.8);
    }

    @Test
    void rejectsMinDelayAboveMaxDelay() {
        ScoutProperties properties = new ScoutProperties();
        properties.getFetch().setMinDelaySeconds(2.0);
        properties.getFetch().setMaxDelaySeconds(1.0);
        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("min-delay-seconds");
    }

    @Test
    void rejectsNonFiniteDelays() {
        ScoutProperties notANumber = new ScoutProperties();
        notANumber.getFetch().setMinDelaySeconds(Double.NaN);
        notANumber.getFetch().setMaxDelaySeconds(Double.NaN);
        assertThatThrownBy(notANumber::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("finite");

        ScoutProperties unbounded = new ScoutProperties();
        unbounded.getFetch().setMaxDelaySeconds(Double.POSITIVE_INFINITY);
        assertThatThrownBy(unbounded::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("finite");
    }

    @Test
    void rejectsNegativeDelayAndWorkerCount() {
        ScoutProperties negativeDelay = new ScoutProperties();
        negativeDelay.getFetch().setMinDelaySeconds(-1);
        assertThatThrownBy(negativeDelay::validate).isInstanceOf(IllegalStateException.class);

        ScoutProperties noWorkers = new ScoutProperties();
        noWorkers.getFetch().setMaxWorkers(0);
        assertThatThrownBy(noWorkers::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("max-workers");
    }

    @Test
    void blankSeedsAreIgnoredAndEmptySeedListIsRejected() {
        ScoutProperties properties = new ScoutProperties();
        properties.getSitemap().setSeeds(Arrays.asList(" https://a.example/sitemap.xml ", " ", null));
        assertThat(properties.getSitemap().getSeeds()).containsExactly("https://a.example/sitemap.xml");

        properties.getSitemap().setSeeds(List.of());
        assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
    }
}
