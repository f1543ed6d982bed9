package com.venturescout.model;

import com.venturescout.config.Config;

/**
 * Fixed blend of fit, quality and portfolio fit into the overall score. Weights are normalized by
 * their sum; an all-zero configuration falls back to the defaults.
 */
public record OverallWeights(double fit, double quality, double portfolio) {
    public static final OverallWeights DEFAULT = new OverallWeights(0.4, 0.3, 0.3);

    public OverallWeights {
        fit = Math.max(0.0, finiteOrZero(fit));
        quality = Math.max(0.0, finiteOrZero(quality));
        portfolio = Math.max(0.0, finiteOrZero(portfolio));
    }

    public static OverallWeights fromConfig(Config config) {
        if (config == null) {
            return DEFAULT;
        }
        return new OverallWeights(
                config.getDouble("weight.overall.fit", DEFAULT.fit),
                config.getDouble("weight.overall.quality", DEFAULT.quality),
                config.getDouble("weight.overall.portfolio", DEFAULT.portfolio)
        );
    }

    public double blend(double fitScore, double qualityScore, double portfolioFitScore) {
        double sum = fit + quality + portfolio;
        if (sum <= 0.0) {
            return DEFAULT.blend(fitScore, qualityScore, portfolioFitScore);
        }
        double raw = (fitScore * fit + qualityScore * quality + portfolioFitScore * portfolio) / sum;
        return Math.round(Math.max(0.0, Math.min(100.0, raw)) * 100.0) / 100.0;
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
