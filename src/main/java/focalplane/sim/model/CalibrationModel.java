package focalplane.sim.model;

import focalplane.sim.utilities.LegendrePolynomials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-order 2D orthogonal-polynomial (Legendre) distortion model of the angular field.
 *
 * <p>Mathematical model, for a normalized field point (etaTilde, zetaTilde):</p>
 * <pre>
 * deltaEta  = sum over enabled (r,s) of  etaCoeff[r,s]  * L(r, zetaTilde) * L(s, etaTilde) * 10^orderScale[r+s]
 * deltaZeta = sum over enabled (r,s) of  zetaCoeff[r,s] * L(r, zetaTilde) * L(s, etaTilde) * 10^orderScale[r+s]
 * </pre>
 *
 * <p>Note the axis swap: the r-degree polynomial is evaluated on zeta and the s-degree polynomial on eta. The
 * model is defined in the frame of the reference detector, whose rotation rows {@code [0, 1, -1, 0]} map its
 * kappa axis onto -zeta and its mu axis onto eta.</p>
 *
 * <p>Coefficients are stored in a human-friendly magnitude; each order carries an independent decimal exponent
 * applied at evaluation time. Disabling a term removes its effect but keeps its stored coefficients.</p>
 *
 * <p>Instances are owned by a single exposure and are not thread-safe: coefficient edits and evaluations must
 * be serialized by the caller.</p>
 *
 * @author Mike Nelson
 * @since 1.0
 */
public class CalibrationModel {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationModel.class);

    /** Highest total degree of the expansion. */
    public static final int HIGHEST_ORDER = 5;

    /** Number of (r, s) terms: (H+1)(H+2)/2. */
    public static final int TERM_COUNT = (HIGHEST_ORDER + 1) * (HIGHEST_ORDER + 2) / 2;

    /** Decimal exponents applied per order when no other scale is configured. */
    private static final int[] DEFAULT_ORDER_SCALE = {-2, -3, -4, -4, -5, -6};

    private final int[] orderScale = new int[HIGHEST_ORDER + 1];
    private final boolean[] enabled = new boolean[TERM_COUNT];
    private final double[] etaCoeff = new double[TERM_COUNT];
    private final double[] zetaCoeff = new double[TERM_COUNT];

    /**
     * Creates a model with every term enabled, zero coefficients and the default order scales.
     */
    public CalibrationModel() {
        System.arraycopy(DEFAULT_ORDER_SCALE, 0, orderScale, 0, orderScale.length);
        reset();
    }

    /**
     * Creates an independent deep copy of another model.
     *
     * @param other model to copy
     */
    public CalibrationModel(CalibrationModel other) {
        System.arraycopy(other.orderScale, 0, orderScale, 0, orderScale.length);
        System.arraycopy(other.enabled, 0, enabled, 0, TERM_COUNT);
        System.arraycopy(other.etaCoeff, 0, etaCoeff, 0, TERM_COUNT);
        System.arraycopy(other.zetaCoeff, 0, zetaCoeff, 0, TERM_COUNT);
    }

    /**
     * @return an independent deep copy of this model
     */
    public CalibrationModel copy() {
        return new CalibrationModel(this);
    }

    /**
     * Enables every term and zeroes both coefficients. Order scales are left untouched.
     */
    public void reset() {
        Arrays.fill(enabled, true);
        Arrays.fill(etaCoeff, 0.0);
        Arrays.fill(zetaCoeff, 0.0);
        logger.debug("Calibration model reset: {} terms enabled, coefficients zeroed", TERM_COUNT);
    }

    /**
     * Evaluates the distortion at a normalized field point.
     *
     * @param point normalized field coordinates (etaTilde, zetaTilde)
     * @return distortion offsets in radians
     */
    public CalibrationDelta terms(NormalizedFieldCoordinates point) {
        double deltaEta = 0.0;
        double deltaZeta = 0.0;
        for (int o = 0; o <= HIGHEST_ORDER; o++) {
            double os = Math.pow(10.0, orderScale[o]);
            for (TermKey key : TermKey.ofOrder(o)) {
                int i = key.index();
                if (!enabled[i]) {
                    continue;
                }
                double psi = LegendrePolynomials.evaluate(key.r(), point.zetaTilde())
                        * LegendrePolynomials.evaluate(key.s(), point.etaTilde());
                deltaEta += etaCoeff[i] * psi * os;
                deltaZeta += zetaCoeff[i] * psi * os;
            }
        }
        return new CalibrationDelta(deltaEta, deltaZeta);
    }

    /**
     * Exports the effective calibration law: one record per order holding the scale-applied coefficients,
     * with disabled terms reported as 0.
     *
     * @return {@code HIGHEST_ORDER + 1} records in ascending order
     */
    public List<OrderCoefficients> data() {
        List<OrderCoefficients> result = new ArrayList<>(HIGHEST_ORDER + 1);
        for (int o = 0; o <= HIGHEST_ORDER; o++) {
            double os = Math.pow(10.0, orderScale[o]);
            Map<String, Double> order = new LinkedHashMap<>();
            for (TermKey key : TermKey.ofOrder(o)) {
                int i = key.index();
                order.put("eta" + key.identifier(), enabled[i] ? etaCoeff[i] * os : 0.0);
                order.put("zeta" + key.identifier(), enabled[i] ? zetaCoeff[i] * os : 0.0);
            }
            result.add(new OrderCoefficients(o, order));
        }
        return result;
    }

    // ==================== TERM ACCESS ====================

    public boolean isEnabled(TermKey key) {
        return enabled[key.index()];
    }

    public boolean isEnabled(int r, int s) {
        return isEnabled(new TermKey(r, s));
    }

    public void setEnabled(TermKey key, boolean value) {
        enabled[key.index()] = value;
    }

    public void setEnabled(int r, int s, boolean value) {
        setEnabled(new TermKey(r, s), value);
    }

    /**
     * Enables or disables every term at once.
     *
     * @param value new enable flag for all terms
     */
    public void setAllEnabled(boolean value) {
        Arrays.fill(enabled, value);
    }

    /**
     * @param key term
     * @return stored (unscaled) eta coefficient
     */
    public double getEtaCoefficient(TermKey key) {
        return etaCoeff[key.index()];
    }

    public double getEtaCoefficient(int r, int s) {
        return getEtaCoefficient(new TermKey(r, s));
    }

    public void setEtaCoefficient(TermKey key, double value) {
        etaCoeff[key.index()] = value;
    }

    public void setEtaCoefficient(int r, int s, double value) {
        setEtaCoefficient(new TermKey(r, s), value);
    }

    /**
     * @param key term
     * @return stored (unscaled) zeta coefficient
     */
    public double getZetaCoefficient(TermKey key) {
        return zetaCoeff[key.index()];
    }

    public double getZetaCoefficient(int r, int s) {
        return getZetaCoefficient(new TermKey(r, s));
    }

    public void setZetaCoefficient(TermKey key, double value) {
        zetaCoeff[key.index()] = value;
    }

    public void setZetaCoefficient(int r, int s, double value) {
        setZetaCoefficient(new TermKey(r, s), value);
    }

    // ==================== ORDER SCALES ====================

    /**
     * @param order total degree in [0, HIGHEST_ORDER]
     * @return decimal exponent applied to the coefficients of that order
     */
    public int getOrderScale(int order) {
        checkOrder(order);
        return orderScale[order];
    }

    /**
     * Sets the decimal exponent applied to the coefficients of one order.
     *
     * @param order total degree in [0, HIGHEST_ORDER]
     * @param exponent decimal exponent, e.g. -4 for a factor of 1e-4
     */
    public void setOrderScale(int order, int exponent) {
        checkOrder(order);
        orderScale[order] = exponent;
    }

    /**
     * @return a copy of all order exponents, indexed by order
     */
    public int[] getOrderScales() {
        return orderScale.clone();
    }

    /**
     * @param order total degree in [0, HIGHEST_ORDER]
     * @return {@code 10^orderScale[order]}
     */
    public double getOrderFactor(int order) {
        return Math.pow(10.0, getOrderScale(order));
    }

    static void checkOrder(int order) {
        if (order < 0 || order > HIGHEST_ORDER) {
            throw new IllegalArgumentException(
                    "Calibration order must be in [0, " + HIGHEST_ORDER + "], got " + order);
        }
    }

    @Override
    public String toString() {
        int active = 0;
        for (int i = 0; i < TERM_COUNT; i++) {
            if (enabled[i] && (etaCoeff[i] != 0.0 || zetaCoeff[i] != 0.0)) {
                active++;
            }
        }
        return String.format("CalibrationModel[%d active terms, orderScale=%s]", active, Arrays.toString(orderScale));
    }
}
