package focalplane.sim.model;

/**
 * Rectangular pixel-space extent of a detector, defined by two corner points.
 *
 * <p>With the pixel-center convention, a detector of {@code columns x rows} pixels whose origin is
 * {@code (kappa0, mu0)} covers {@code [kappa0 - 0.5, kappa0 - 0.5 + columns] x [mu0 - 0.5, mu0 - 0.5 + rows]}.
 * Both edges are inclusive.</p>
 *
 * <p>Corner points can be given in any order; {@link #getMinKappa()} and friends normalize them.</p>
 *
 * @since 1.0
 */
public class DetectorBounds {
    private final double kappa1;
    private final double mu1;
    private final double kappa2;
    private final double mu2;

    /**
     * @param kappa1 kappa of the first corner
     * @param mu1 mu of the first corner
     * @param kappa2 kappa of the second corner
     * @param mu2 mu of the second corner
     */
    public DetectorBounds(double kappa1, double mu1, double kappa2, double mu2) {
        this.kappa1 = kappa1;
        this.mu1 = mu1;
        this.kappa2 = kappa2;
        this.mu2 = mu2;
    }

    public double getMinKappa() { return Math.min(kappa1, kappa2); }

    public double getMaxKappa() { return Math.max(kappa1, kappa2); }

    public double getMinMu() { return Math.min(mu1, mu2); }

    public double getMaxMu() { return Math.max(mu1, mu2); }

    /**
     * @return extent along kappa, in pixels
     */
    public double getWidth() { return Math.abs(kappa2 - kappa1); }

    /**
     * @return extent along mu, in pixels
     */
    public double getHeight() { return Math.abs(mu2 - mu1); }

    /**
     * @param pixel pixel-space point
     * @return true if the point lies within the bounds, edges included
     */
    public boolean contains(PixelCoordinates pixel) {
        return pixel.kappa() >= getMinKappa() && pixel.kappa() <= getMaxKappa()
                && pixel.mu() >= getMinMu() && pixel.mu() <= getMaxMu();
    }

    @Override
    public String toString() {
        return String.format("[%s, %s] x [%s, %s]", getMinKappa(), getMaxKappa(), getMinMu(), getMaxMu());
    }
}
