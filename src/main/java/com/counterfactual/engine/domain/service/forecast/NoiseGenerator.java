package com.counterfactual.engine.domain.service.forecast;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Bounded Gaussian noise for one (entity, event) rollout. Draws are truncated to
 * {@value #TRUNCATION} standard units before scaling.
 */
public final class NoiseGenerator {

    static final double TRUNCATION = 3.0;

    private static final NoiseGenerator SILENT = new NoiseGenerator(null, 0.0);

    private final SplittableRandom rng;
    private final double scale;

    private NoiseGenerator(SplittableRandom rng, double scale) {
        this.rng = rng;
        this.scale = scale;
    }

    public static NoiseGenerator forPair(ForecastConfig config, String entityId, String eventName,
                                         double residualStd) {
        double scale = config.getNoiseFactor() * residualStd;
        if (!(scale > 0.0) || !Double.isFinite(scale)) {
            return SILENT;
        }
        SplittableRandom rng = config.getNoiseMode() == NoiseMode.SEEDED
                ? new SplittableRandom(seedFor(config.getNoiseSeed(), entityId, eventName))
                : new SplittableRandom();
        return new NoiseGenerator(rng, scale);
    }

    static long seedFor(long baseSeed, String entityId, String eventName) {
        return baseSeed * 1_000_003L + Objects.hash(entityId, eventName);
    }

    public boolean isSilent() {
        return rng == null;
    }

    public double next() {
        if (rng == null) return 0.0;
        double z = rng.nextGaussian();
        z = Math.max(-TRUNCATION, Math.min(TRUNCATION, z));
        return z * scale;
    }
}
