package focalplane.sim.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Quaternion}.
 */
class QuaternionTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    void testMultiply_IdentityIsNeutral() {
        Quaternion q = new Quaternion(0.1, -0.2, 0.3, 0.9);
        assertArrayEquals(q.toArray(), q.multiply(Quaternion.IDENTITY).toArray(), 0.0);
        assertArrayEquals(q.toArray(), Quaternion.IDENTITY.multiply(q).toArray(), 0.0);
    }

    @Test
    void testMultiply_HamiltonUnitProducts() {
        Quaternion i = new Quaternion(1, 0, 0, 0);
        Quaternion j = new Quaternion(0, 1, 0, 0);
        Quaternion k = new Quaternion(0, 0, 1, 0);

        assertArrayEquals(k.toArray(), i.multiply(j).toArray(), 0.0);
        assertArrayEquals(i.toArray(), j.multiply(k).toArray(), 0.0);
        assertArrayEquals(j.toArray(), k.multiply(i).toArray(), 0.0);
        assertArrayEquals(new double[]{0, 0, 0, -1}, i.multiply(i).toArray(), 0.0);
    }

    @Test
    void testInverse_IsConjugate() {
        Quaternion q = new Quaternion(0.1, -0.2, 0.3, 0.9);
        assertArrayEquals(new double[]{-0.1, 0.2, -0.3, 0.9}, q.inverse().toArray(), 0.0);
    }

    @Test
    void testInverse_UnitQuaternionTimesInverseIsIdentity() {
        double half = Math.PI / 8;
        Quaternion q = new Quaternion(0.0, 0.0, Math.sin(half), Math.cos(half));
        assertEquals(1.0, q.norm(), TOLERANCE);

        double[] product = q.multiply(q.inverse()).toArray();
        assertArrayEquals(new double[]{0, 0, 0, 1}, product, TOLERANCE);
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, 0.0",
            "0.5, 0.25",
            "-2.5, 1.2",
            "3.0, -1.4",
            "-0.001, 0.0005"
    })
    @DisplayName("Identity rotation returns the input angles")
    void testRotateAngular_IdentityPreservesAngles(double alpha, double delta) {
        double[] result = Quaternion.IDENTITY.rotateAngular(alpha, delta);
        assertEquals(alpha, result[0], TOLERANCE);
        assertEquals(delta, result[1], TOLERANCE);
    }

    @Test
    void testRotateAngular_QuarterTurnAboutZShiftsAlpha() {
        double half = Math.PI / 4;
        Quaternion q = new Quaternion(0.0, 0.0, Math.sin(half), Math.cos(half));

        double[] result = q.rotateAngular(0.3, 0.2);

        assertEquals(0.3 + Math.PI / 2, result[0], TOLERANCE);
        assertEquals(0.2, result[1], TOLERANCE);
    }

    @Test
    void testRotateAngular_InverseUndoesRotation() {
        Quaternion q = new Quaternion(0.2, -0.1, 0.4, 0.0);
        double norm = q.norm();
        q = new Quaternion(q.getX() / norm, q.getY() / norm, q.getZ() / norm, q.getW() / norm);

        double[] there = q.rotateAngular(0.7, -0.3);
        double[] back = q.inverse().rotateAngular(there);

        assertEquals(0.7, back[0], 1e-9);
        assertEquals(-0.3, back[1], 1e-9);
    }

    @Test
    void testRotateAngular_PoleDoesNotProduceNaN() {
        double[] result = Quaternion.IDENTITY.rotateAngular(0.0, Math.PI / 2);
        assertFalse(Double.isNaN(result[1]));
        assertEquals(Math.PI / 2, result[1], 1e-7);
    }

    @Test
    void testOf_RejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> Quaternion.of(new double[]{0, 0, 1}));
        assertThrows(IllegalArgumentException.class, () -> Quaternion.of(null));
        assertEquals(Quaternion.IDENTITY, Quaternion.of(new double[]{0, 0, 0, 1}));
    }

    @Test
    void testRotateAngular_RejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> Quaternion.IDENTITY.rotateAngular(new double[]{1.0}));
    }
}
