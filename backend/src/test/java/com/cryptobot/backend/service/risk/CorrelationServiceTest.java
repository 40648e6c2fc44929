package com.cryptobot.backend.service.risk;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorrelationServiceTest {

    private final CorrelationService service = new CorrelationService();

    @Test
    void scaledSeriesArePerfectlyCorrelated() {
        List<Double> base = List.of(100.0, 101.0, 99.0, 102.0, 103.0, 101.0, 104.0, 105.0);
        List<Double> scaled = List.of(200.0, 202.0, 198.0, 204.0, 206.0, 202.0, 208.0, 210.0);

        OptionalDouble correlation = service.calculateCorrelation(base, scaled);

        assertTrue(correlation.getAsDouble() > 0.99);
    }

    @Test
    void mirroredSeriesAreNegativelyCorrelated() {
        List<Double> up = List.of(1.0, 2.0, 3.0, 4.0);
        List<Double> down = List.of(4.0, 3.0, 2.0, 1.0);

        assertThat(service.calculateCorrelation(up, down).getAsDouble()).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void flatOrMismatchedSeriesAreUnavailable() {
        assertThat(service.calculateCorrelation(List.of(1.0, 1.0, 1.0), List.of(1.0, 2.0, 3.0))).isEmpty();
        assertThat(service.calculateCorrelation(List.of(1.0, 2.0), List.of(1.0, 2.0, 3.0))).isEmpty();
        assertThat(service.calculateCorrelation(List.of(), List.of())).isEmpty();
    }

    @Test
    void trailingCorrelationNeedsFullLookback() {
        List<Double> a = new ArrayList<>();
        List<Double> b = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            a.add(10.0 + i);
            // uncorrelated noise early, tracking later
            b.add(i < 10 ? (i % 2 == 0 ? 100.0 : 0.0) : 20.0 + 2 * i);
        }

        assertThat(service.trailingCorrelation(a.subList(0, 29), b.subList(0, 29), 30)).isEmpty();
        assertThat(service.trailingCorrelation(a, b, 30).getAsDouble()).isCloseTo(1.0, within(1e-9));
    }
}
