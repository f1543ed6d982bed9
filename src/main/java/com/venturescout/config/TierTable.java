package com.venturescout.config;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Threshold tiers evaluated best-first: the first tier whose bound the value satisfies wins.
 */
public final class TierTable {

    public enum Mode {
        AT_LEAST,
        GREATER_THAN,
        LESS_THAN
    }

    public record Tier(double bound, double points) {
    }

    private final Mode mode;
    private final List<Tier> tiers;

    private TierTable(Mode mode, List<Tier> tiers) {
        this.mode = mode;
        List<Tier> sorted = new ArrayList<>(tiers);
        Comparator<Tier> byBound = Comparator.comparingDouble(Tier::bound);
        sorted.sort(mode == Mode.LESS_THAN ? byBound : byBound.reversed());
        this.tiers = List.copyOf(sorted);
    }

    /**
     * @param boundPointPairs alternating bound and points values
     */
    public static TierTable of(Mode mode, double... boundPointPairs) {
        if (mode == null) {
            throw new IllegalArgumentException("tier mode is required");
        }
        if (boundPointPairs == null || boundPointPairs.length % 2 != 0) {
            throw new IllegalArgumentException("tiers must be given as bound/points pairs");
        }
        List<Tier> tiers = new ArrayList<>();
        for (int i = 0; i < boundPointPairs.length; i += 2) {
            tiers.add(new Tier(boundPointPairs[i], boundPointPairs[i + 1]));
        }
        return new TierTable(mode, tiers);
    }

    public double pointsFor(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        for (Tier tier : tiers) {
            boolean hit;
            switch (mode) {
                case AT_LEAST:
                    hit = value >= tier.bound();
                    break;
                case GREATER_THAN:
                    hit = value > tier.bound();
                    break;
                default:
                    hit = value < tier.bound();
                    break;
            }
            if (hit) {
                return tier.points();
            }
        }
        return 0.0;
    }
}
