package com.cryptobot.backend.service.indicator;

import com.cryptobot.backend.model.Candle;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalDouble;

@Service
public class AtrService {

    /**
     * Simple average of the true range over the trailing {@code period} bars.
     * The first bar of the series has no previous close, so its true range is high - low.
     */
    public OptionalDouble computeAtr(List<Double> highs, List<Double> lows, List<Double> closes, int period) {
        int size = closes.size();
        if (highs.size() != size || lows.size() != size) {
            throw new IllegalArgumentException("high/low/close series must have equal length");
        }
        if (period < 1 || size < period) {
            return OptionalDouble.empty();
        }
        double sum = 0.0;
        for (int i = size - period; i < size; i++) {
            double high = highs.get(i);
            double low = lows.get(i);
            double tr = high - low;
            if (i > 0) {
                double prevClose = closes.get(i - 1);
                tr = Math.max(tr, Math.max(Math.abs(high - prevClose), Math.abs(low - prevClose)));
            }
            sum += tr;
        }
        return OptionalDouble.of(sum / period);
    }

    public OptionalDouble calculate(List<Candle> candles, int period) {
        if (candles == null || candles.isEmpty()) {
            return OptionalDouble.empty();
        }
        return computeAtr(
                candles.stream().map(Candle::getHigh).toList(),
                candles.stream().map(Candle::getLow).toList(),
                candles.stream().map(Candle::getClose).toList(),
                period);
    }
}
