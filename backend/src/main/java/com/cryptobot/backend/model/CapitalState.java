package com.cryptobot.backend.model;

/**
 * Current and peak capital. Peak never decreases and never falls below current.
 */
public class CapitalState {

    private double current;
    private double peak;

    public CapitalState(double initialCapital) {
        this.current = initialCapital;
        this.peak = initialCapital;
    }

    public double current() {
        return current;
    }

    public double peak() {
        return peak;
    }

    public void apply(double delta) {
        current += delta;
        peak = Math.max(peak, current);
    }

    public double drawdown() {
        if (peak <= 0 || current >= peak) {
            return 0.0;
        }
        return (peak - current) / peak;
    }
}
