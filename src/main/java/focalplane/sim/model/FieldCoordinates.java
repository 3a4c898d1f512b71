package focalplane.sim.model;

/**
 * Angular field coordinates (eta, zeta) in radians, in the instrument's field-of-view reference frame.
 * Both undistorted and distorted field positions use this type.
 *
 * @param eta first field angle in radians
 * @param zeta second field angle in radians
 * @since 1.0
 */
public record FieldCoordinates(double eta, double zeta) {

    @Override
    public String toString() {
        return String.format("(eta=%.9e, zeta=%.9e)", eta, zeta);
    }
}
