package focalplane.sim.model;

import java.util.Optional;

/**
 * A single 2D sample of a focal-plane pattern: a star, a catalog entry, an observation or a detector corner.
 *
 * <p>Coordinate systems a point passes through (see {@code TransformationFunctions} for the transforms):</p>
 * <ol>
 *   <li>(xTilde, yTilde): normalized logical, [0, 1] x [0, 1]; used only at construction</li>
 *   <li>(x, y): logical, {@code scale * (tilde - 0.5) + 0.5}; stored permanently</li>
 *   <li>(kappa, mu): detector pixel space</li>
 *   <li>(eta, zeta): angular field, radians</li>
 *   <li>(etaTilde, zetaTilde): normalized angular field</li>
 *   <li>(etaD, zetaD): distorted angular field</li>
 *   <li>(etaDTilde, zetaDTilde): normalized distorted field, cached here by {@code prepare}</li>
 * </ol>
 *
 * <p>A point carries no geometry: the same instance can be transformed against any mission, detector and
 * calibration. The only mutable state is the cached normalized distorted position, overwritten on each
 * {@code prepare} call.</p>
 *
 * @author Mike Nelson
 * @since 1.0
 */
public class Point {
    private final double normalizedX;
    private final double normalizedY;
    private final double scale;
    private final double x;
    private final double y;

    private NormalizedFieldCoordinates distortedNormalized;

    /**
     * @param normalizedX normalized logical coordinate xTilde
     * @param normalizedY normalized logical coordinate yTilde
     * @param scale range scaling factor; 1.0 spans exactly one detector
     */
    public Point(double normalizedX, double normalizedY, double scale) {
        this.normalizedX = normalizedX;
        this.normalizedY = normalizedY;
        this.scale = scale;
        this.x = scale * (normalizedX - 0.5) + 0.5;
        this.y = scale * (normalizedY - 0.5) + 0.5;
    }

    public double getNormalizedX() { return normalizedX; }
    public double getNormalizedY() { return normalizedY; }
    public double getScale() { return scale; }

    /**
     * @return logical x coordinate
     */
    public double getX() { return x; }

    /**
     * @return logical y coordinate
     */
    public double getY() { return y; }

    /**
     * @return normalized distorted field coordinates from the last {@code prepare} call, if any
     */
    public Optional<NormalizedFieldCoordinates> getDistortedNormalized() {
        return Optional.ofNullable(distortedNormalized);
    }

    public void setDistortedNormalized(NormalizedFieldCoordinates distortedNormalized) {
        this.distortedNormalized = distortedNormalized;
    }

    /**
     * @param other another point
     * @param tolerance absolute tolerance on both logical coordinates
     * @return true if both logical coordinates match within the tolerance
     */
    public boolean coincidesWith(Point other, double tolerance) {
        return Math.abs(x - other.x) < tolerance && Math.abs(y - other.y) < tolerance;
    }

    @Override
    public String toString() {
        return String.format("Point(x=%.6f, y=%.6f)", x, y);
    }
}
