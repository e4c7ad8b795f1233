package org.imbalance.resampling;

import org.imbalance.config.SamplingConfig;

import java.util.List;

public class ResamplerFactory {

    private ResamplerFactory() {
        throw new AssertionError("Utility class");
    }

    /**
     * The strategies compared by a run, baseline first. Built once and reused for both label variants.
     */
    public static List<Resampler> returnAllResamplers(SamplingConfig config) {
        int seed = config.getRandomState();
        int k = config.getNeighbours();
        int m = config.getDangerNeighbours();
        return List.of(
                new OriginalResampler(),
                new RandomOverSampler(seed),
                new SmoteResampler(k, config.getSmoteRandomState()),
                new AdasynResampler(k, seed),
                new BorderlineSmoteResampler(BorderlineSmoteResampler.Kind.BORDERLINE_1, k, m, seed),
                new BorderlineSmoteResampler(BorderlineSmoteResampler.Kind.BORDERLINE_2, k, m, seed),
                new SvmSmoteResampler(k, m, seed),
                new SmoteNcResampler(config.getSmoteNcCategoricalFeatures(), k, seed)
        );
    }
}
