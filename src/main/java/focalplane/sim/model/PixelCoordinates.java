package focalplane.sim.model;

/**
 * Detector pixel-space coordinates (kappa, mu) in pixel units, pixel-center convention.
 *
 * @param kappa column coordinate
 * @param mu row coordinate
 * @since 1.0
 */
public record PixelCoordinates(double kappa, double mu) {

    @Override
    public String toString() {
        return String.format("(kappa=%.6f, mu=%.6f)", kappa, mu);
    }
}
