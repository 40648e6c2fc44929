package com.cryptobot.backend.service.indicator;

import com.cryptobot.backend.model.Candle;
import com.cryptobot.backend.util.TestBarFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AtrServiceTest {

    private final AtrService atrService = new AtrService();

    @Test
    void averagesTrueRangeOverTrailingPeriod() {
        List<Double> highs = List.of(10.0, 12.0, 13.0, 15.0);
        List<Double> lows = List.of(9.0, 10.0, 11.0, 12.0);
        List<Double> closes = List.of(9.5, 11.0, 12.5, 14.0);

        // trailing TRs: max(2, 2.5, 0.5), max(2, 2, 0), max(3, 2.5, 0.5)
        OptionalDouble atr = atrService.computeAtr(highs, lows, closes, 3);

        assertThat(atr.getAsDouble()).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void gapsCountTowardTrueRange() {
        List<Double> highs = List.of(10.0, 21.0);
        List<Double> lows = List.of(9.0, 20.0);
        List<Double> closes = List.of(10.0, 20.5);

        // second bar gapped: |21 - 10| = 11
        assertThat(atrService.computeAtr(highs, lows, closes, 1).getAsDouble()).isCloseTo(11.0, within(1e-9));
    }

    @Test
    void unavailableWithTooFewBars() {
        assertThat(atrService.computeAtr(List.of(10.0), List.of(9.0), List.of(9.5), 14)).isEmpty();
        assertThat(atrService.calculate(List.of(), 14)).isEmpty();
    }

    @Test
    void rejectsMismatchedSeries() {
        assertThatThrownBy(() -> atrService.computeAtr(List.of(1.0, 2.0), List.of(1.0), List.of(1.0, 2.0), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calculatesFromCandles() {
        List<Candle> candles = new ArrayList<>();
        Instant ts = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 20; i++) {
            candles.add(TestBarFactory.candle(100 + i, 100 + i + 1, ts.plusSeconds(i * 60L)));
        }

        OptionalDouble atr = atrService.calculate(candles, 14);

        // each bar spans open..close plus 0.5 either side, no gaps beyond that
        assertThat(atr.getAsDouble()).isCloseTo(2.0, within(1e-9));
    }
}
