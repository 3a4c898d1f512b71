package focalplane.sim.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective (scale-applied) coefficients of one calibration order, as exported by
 * {@link CalibrationModel#data()}.
 *
 * <p>Coefficients are keyed {@code eta<rs>} and {@code zeta<rs>}, e.g. {@code eta21}, in ascending s.
 * Disabled terms are reported as 0.</p>
 *
 * @param order total polynomial degree of the terms
 * @param coefficients unmodifiable, insertion-ordered map of the 2(order+1) coefficients
 * @since 1.0
 */
public record OrderCoefficients(int order, Map<String, Double> coefficients) {

    public OrderCoefficients {
        coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
    }

    /**
     * @param key a term of this order
     * @return effective eta coefficient
     */
    public double eta(TermKey key) {
        return lookup("eta", key);
    }

    /**
     * @param key a term of this order
     * @return effective zeta coefficient
     */
    public double zeta(TermKey key) {
        return lookup("zeta", key);
    }

    private double lookup(String prefix, TermKey key) {
        Double value = coefficients.get(prefix + key.identifier());
        if (value == null) {
            throw new IllegalArgumentException("Term " + key + " does not belong to order " + order);
        }
        return value;
    }
}
