package com.example.game2048.logic;

import java.util.List;

/**
 * Source of randomness for tile spawns. Injected everywhere a tile is spawned
 * so that a fixed seed replays a game exactly.
 */
public interface RandomSource {

    /**
     * @return a uniformly distributed int in [0, bound)
     */
    int nextInt(int bound);

    /**
     * @return a uniformly distributed double in [0, 1)
     */
    double nextDouble();

    default <T> T choice(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return items.get(nextInt(items.size()));
    }

    /**
     * Picks one value with probability proportional to its weight.
     */
    default <T> T weightedChoice(List<T> values, List<Double> weights) {
        if (values.isEmpty() || values.size() != weights.size()) {
            throw new IllegalArgumentException("Values and weights must be non-empty and of equal size");
        }
        double total = 0;
        for (double weight : weights) {
            total += weight;
        }
        double target = nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < values.size(); i++) {
            cumulative += weights.get(i);
            if (target < cumulative) {
                return values.get(i);
            }
        }
        return values.get(values.size() - 1);
    }
}
