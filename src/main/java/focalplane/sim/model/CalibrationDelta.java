package focalplane.sim.model;

/**
 * Distortion offsets produced by a {@link CalibrationModel} at one normalized field point, in radians.
 *
 * @param deltaEta offset added to eta
 * @param deltaZeta offset added to zeta
 * @since 1.0
 */
public record CalibrationDelta(double deltaEta, double deltaZeta) {

    /**
     * Applies these offsets to an undistorted field position.
     *
     * @param field undistorted field coordinates
     * @return distorted field coordinates
     */
    public FieldCoordinates applyTo(FieldCoordinates field) {
        return new FieldCoordinates(field.eta() + deltaEta, field.zeta() + deltaZeta);
    }
}
