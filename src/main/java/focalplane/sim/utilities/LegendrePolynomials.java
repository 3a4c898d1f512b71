package focalplane.sim.utilities;

/**
 * Closed-form Legendre polynomials shifted onto the unit interval.
 *
 * <p>The polynomials are evaluated at {@code t = x - 0.5}, so that the orthogonality interval is [0, 1]
 * rather than [-1, 1]:</p>
 * <pre>
 * L0 = 1
 * L1 = 2t
 * L2 = 6t^2 - 0.5
 * L3 = 20t^3 - 3t
 * L4 = 70t^4 - 15t^2 + 0.375
 * L5 = 252t^5 - 70t^3 + 3.75t
 * </pre>
 *
 * @since 1.0
 */
public final class LegendrePolynomials {

    /** Highest order with a closed form. */
    public static final int MAX_ORDER = 5;

    private LegendrePolynomials() {
    }

    /**
     * Evaluates the shifted Legendre polynomial of the given order.
     *
     * <p>Orders outside [0, {@value #MAX_ORDER}] evaluate to 0 so that callers may loop past the supported
     * range without branching.</p>
     *
     * @param order polynomial order
     * @param x point in (nominally) [0, 1]
     * @return polynomial value
     */
    public static double evaluate(int order, double x) {
        double t = x - 0.5;
        return switch (order) {
            case 0 -> 1.0;
            case 1 -> 2.0 * t;
            case 2 -> 6.0 * t * t - 0.5;
            case 3 -> 20.0 * t * t * t - 3.0 * t;
            case 4 -> 70.0 * t * t * t * t - 15.0 * t * t + 3.0 / 8.0;
            case 5 -> 252.0 * t * t * t * t * t - 70.0 * t * t * t + 15.0 / 4.0 * t;
            default -> 0.0;
        };
    }
}
