package com.cryptobot.backend.service.risk;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalDouble;

@Service
public class CorrelationService {

    /**
     * Pearson correlation of two equally long price series, in [-1, 1].
     * Empty when the series differ in length, are empty, or one of them is flat.
     */
    public OptionalDouble calculateCorrelation(List<Double> series1, List<Double> series2) {
        if (series1.size() != series2.size() || series1.isEmpty()) {
            return OptionalDouble.empty();
        }

        double mean1 = series1.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double mean2 = series2.stream().mapToDouble(Double::doubleValue).average().orElse(0);

        double covariance = 0;
        double variance1 = 0;
        double variance2 = 0;

        for (int i = 0; i < series1.size(); i++) {
            double diff1 = series1.get(i) - mean1;
            double diff2 = series2.get(i) - mean2;
            covariance += diff1 * diff2;
            variance1 += diff1 * diff1;
            variance2 += diff2 * diff2;
        }

        if (variance1 == 0 || variance2 == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(covariance / Math.sqrt(variance1 * variance2));
    }

    /**
     * Correlation over the trailing {@code lookback} observations of both series.
     * Empty with fewer than {@code lookback} samples on either side.
     */
    public OptionalDouble trailingCorrelation(List<Double> series1, List<Double> series2, int lookback) {
        if (series1.size() < lookback || series2.size() < lookback) {
            return OptionalDouble.empty();
        }
        return calculateCorrelation(
                series1.subList(series1.size() - lookback, series1.size()),
                series2.subList(series2.size() - lookback, series2.size()));
    }
}
