package io.surfworks.tensorforge.core.backend;

/**
 * Parameters of randomized SVD.
 *
 * @param niter    number of power iterations
 * @param oversamp extra sample columns beyond the requested rank
 */
public record RandomizedSvdOptions(int niter, int oversamp) {

    private static final RandomizedSvdOptions DEFAULTS = new RandomizedSvdOptions(1, 5);

    public RandomizedSvdOptions {
        if (niter < 0) {
            throw new IllegalArgumentException("niter must be non-negative, got " + niter);
        }
        if (oversamp < 0) {
            throw new IllegalArgumentException("oversamp must be non-negative, got " + oversamp);
        }
    }

    public static RandomizedSvdOptions defaults() {
        return DEFAULTS;
    }
}
