package focalplane.sim.model;

/**
 * Immutable quaternion {@code q = x*i + y*j + z*k + w}.
 *
 * <p>No normalization is performed. Rotations are angle-preserving only for unit quaternions, and
 * {@link #inverse()} is the true inverse only in that case; callers own the unit-length invariant.</p>
 *
 * @since 1.0
 */
public final class Quaternion {

    /** The identity rotation (0, 0, 0, 1). */
    public static final Quaternion IDENTITY = new Quaternion(0.0, 0.0, 0.0, 1.0);

    private final double x;
    private final double y;
    private final double z;
    private final double w;

    /**
     * @param x first imaginary component
     * @param y second imaginary component
     * @param z third imaginary component
     * @param w real component
     */
    public Quaternion(double x, double y, double z, double w) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.w = w;
    }

    /**
     * Creates a quaternion from a {@code [x, y, z, w]} array.
     *
     * @param components four components, imaginary parts first
     * @return the quaternion
     */
    public static Quaternion of(double[] components) {
        if (components == null || components.length != 4) {
            throw new IllegalArgumentException("Quaternion requires exactly 4 components [x, y, z, w]");
        }
        return new Quaternion(components[0], components[1], components[2], components[3]);
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getZ() { return z; }
    public double getW() { return w; }

    /**
     * Grassmann (Hamilton) product {@code this * other}.
     *
     * @param other right-hand factor
     * @return the product
     */
    public Quaternion multiply(Quaternion other) {
        return new Quaternion(
                x * other.w + y * other.z - z * other.y + w * other.x,
                -x * other.z + y * other.w + z * other.x + w * other.y,
                x * other.y - y * other.x + z * other.w + w * other.z,
                -x * other.x - y * other.y - z * other.z + w * other.w);
    }

    /**
     * @return the conjugate (-x, -y, -z, w)
     */
    public Quaternion inverse() {
        return new Quaternion(-x, -y, -z, w);
    }

    /**
     * @return Euclidean norm of the four components
     */
    public double norm() {
        return Math.sqrt(x * x + y * y + z * z + w * w);
    }

    /**
     * Rotates a direction given as a pair of spherical angles.
     *
     * <p>The angles are embedded as the unit vector
     * {@code (cos(a) cos(d), sin(a) cos(d), sin(d))}, rotated by {@code q v q^-1}, and converted back with
     * {@code atan2} and {@code asin}.</p>
     *
     * @param alpha longitude-like angle in radians
     * @param delta latitude-like angle in radians
     * @return rotated angles {@code [alpha, delta]}
     */
    public double[] rotateAngular(double alpha, double delta) {
        double cosAlpha = Math.cos(alpha);
        double cosDelta = Math.cos(delta);
        double sinAlpha = Math.sin(alpha);
        double sinDelta = Math.sin(delta);
        Quaternion v = new Quaternion(cosAlpha * cosDelta, sinAlpha * cosDelta, sinDelta, 0.0);
        Quaternion r = multiply(v).multiply(inverse());
        // rounding may push |z| marginally above 1 near the poles
        double rz = Math.max(-1.0, Math.min(1.0, r.z));
        return new double[]{Math.atan2(r.y, r.x), Math.asin(rz)};
    }

    /**
     * Array form of {@link #rotateAngular(double, double)}.
     *
     * @param angles {@code [alpha, delta]} in radians
     * @return rotated angles {@code [alpha, delta]}
     */
    public double[] rotateAngular(double[] angles) {
        if (angles == null || angles.length != 2) {
            throw new IllegalArgumentException("Angles must be [alpha, delta]");
        }
        return rotateAngular(angles[0], angles[1]);
    }

    /**
     * @return components as {@code [x, y, z, w]}
     */
    public double[] toArray() {
        return new double[]{x, y, z, w};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quaternion q)) return false;
        return Double.compare(x, q.x) == 0 && Double.compare(y, q.y) == 0
                && Double.compare(z, q.z) == 0 && Double.compare(w, q.w) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(z);
        result = 31 * result + Double.hashCode(w);
        return result;
    }

    @Override
    public String toString() {
        return "[" + x + ", " + y + ", " + z + ", " + w + "]";
    }
}
