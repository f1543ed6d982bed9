package com.venturescout.scoring;

import com.venturescout.config.Config;

public record FitWeights(double similarity, double industry, double stage, double location, double network) {
    public static final FitWeights DEFAULT = new FitWeights(0.40, 0.20, 0.15, 0.10, 0.15);

    public FitWeights {
        similarity = nonNegative(similarity);
        industry = nonNegative(industry);
        stage = nonNegative(stage);
        location = nonNegative(location);
        network = nonNegative(network);
    }

    public static FitWeights fromConfig(Config config) {
        if (config == null) {
            return DEFAULT;
        }
        return new FitWeights(
                config.getDouble("weight.fit.similarity", DEFAULT.similarity),
                config.getDouble("weight.fit.industry", DEFAULT.industry),
                config.getDouble("weight.fit.stage", DEFAULT.stage),
                config.getDouble("weight.fit.location", DEFAULT.location),
                config.getDouble("weight.fit.network", DEFAULT.network)
        );
    }

    public double sum() {
        return similarity + industry + stage + location + network;
    }

    private static double nonNegative(double value) {
        return Double.isFinite(value) ? Math.max(0.0, value) : 0.0;
    }
}
