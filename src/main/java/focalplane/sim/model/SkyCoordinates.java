package focalplane.sim.model;

/**
 * Sky coordinates (alpha, delta) in radians.
 *
 * @param alpha longitude-like angle, in (-pi, pi]
 * @param delta latitude-like angle, in [-pi/2, pi/2]
 * @since 1.0
 */
public record SkyCoordinates(double alpha, double delta) {
}
