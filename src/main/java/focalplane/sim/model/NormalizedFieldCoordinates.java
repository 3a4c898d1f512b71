package focalplane.sim.model;

/**
 * Field coordinates rescaled to the unit square spanned by one detector's corners.
 * Points inside the detector fall in [0, 1] x [0, 1]; points outside are not clamped.
 *
 * @param etaTilde normalized eta
 * @param zetaTilde normalized zeta
 * @since 1.0
 */
public record NormalizedFieldCoordinates(double etaTilde, double zetaTilde) {
}
