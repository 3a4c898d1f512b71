package focalplane.sim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Identifies one term of the 2D orthogonal-polynomial calibration expansion by its pair of degrees (r, s).
 *
 * <p>The total order of the term is {@code r + s}. Keys are laid out in a dense index space ordered by
 * ascending order and, within one order, by ascending {@code s}:</p>
 * <pre>
 * index:  0    1    2    3    4    5    6   ...
 * (r,s): 00   10   01   20   11   02   30   ...
 * </pre>
 *
 * @param r degree of the polynomial evaluated on the zeta axis
 * @param s degree of the polynomial evaluated on the eta axis
 * @since 1.0
 */
public record TermKey(int r, int s) {

    private static final List<TermKey> ALL;

    static {
        List<TermKey> keys = new ArrayList<>();
        for (int o = 0; o <= CalibrationModel.HIGHEST_ORDER; o++) {
            for (int s = 0; s <= o; s++) {
                keys.add(new TermKey(o - s, s));
            }
        }
        ALL = Collections.unmodifiableList(keys);
    }

    public TermKey {
        if (r < 0 || s < 0 || r + s > CalibrationModel.HIGHEST_ORDER) {
            throw new IllegalArgumentException(String.format(
                    "Invalid calibration term (r=%d, s=%d): degrees must be non-negative with r + s <= %d",
                    r, s, CalibrationModel.HIGHEST_ORDER));
        }
    }

    /**
     * Returns every term key in iteration order (ascending order, then ascending s).
     *
     * @return unmodifiable list of all {@link CalibrationModel#TERM_COUNT} keys
     */
    public static List<TermKey> all() {
        return ALL;
    }

    /**
     * Returns the term keys of a single order, ascending by s.
     *
     * @param order total degree in [0, HIGHEST_ORDER]
     * @return the {@code order + 1} keys of that order
     */
    public static List<TermKey> ofOrder(int order) {
        CalibrationModel.checkOrder(order);
        int base = order * (order + 1) / 2;
        return ALL.subList(base, base + order + 1);
    }

    /**
     * Parses the two-character identifier used by the serialized form, e.g. {@code "21"} for r=2, s=1.
     *
     * @param identifier two decimal digits
     * @return the matching key
     * @throws IllegalArgumentException if the identifier is malformed or out of range
     */
    public static TermKey parse(String identifier) {
        if (identifier == null || identifier.length() != 2
                || !Character.isDigit(identifier.charAt(0)) || !Character.isDigit(identifier.charAt(1))) {
            throw new IllegalArgumentException("Calibration term identifier must be two digits: " + identifier);
        }
        return new TermKey(identifier.charAt(0) - '0', identifier.charAt(1) - '0');
    }

    /**
     * @return total polynomial degree r + s
     */
    public int order() {
        return r + s;
    }

    /**
     * @return position of this key in {@link #all()}
     */
    public int index() {
        int o = order();
        return o * (o + 1) / 2 + s;
    }

    /**
     * @return the two-character identifier, e.g. {@code "21"}
     */
    public String identifier() {
        return Integer.toString(r) + s;
    }

    @Override
    public String toString() {
        return identifier();
    }
}
