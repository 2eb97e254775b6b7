package com.atmosight.core.distribution;

import com.atmosight.core.model.DistributionFamily;

import java.util.Objects;

/**
 * Factory that maps a {@link DistributionFamily} to its
 * {@link DistributionFitter}.
 *
 * <p>
 * This is the single point of extension when adding a family: add the enum
 * constant and register its fitter here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DistributionFitters {

    private static final DistributionFitter NORMAL = new NormalFitter();
    private static final DistributionFitter LOG_NORMAL = new LogNormalFitter();
    private static final DistributionFitter GAMMA = new GammaFitter();

    private DistributionFitters() {
        // utility class
    }

    /**
     * @param family the family to fit; must not be {@code null}
     * @return the shared, stateless fitter for {@code family}
     */
    public static DistributionFitter forFamily(DistributionFamily family) {
        Objects.requireNonNull(family, "DistributionFamily must not be null");
        return switch (family) {
            case NORMAL -> NORMAL;
            case LOG_NORMAL -> LOG_NORMAL;
            case GAMMA -> GAMMA;
        };
    }
}
