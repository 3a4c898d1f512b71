package focalplane.sim.utilities;

import focalplane.sim.model.CalibrationModel;
import focalplane.sim.model.DetectorBounds;
import focalplane.sim.model.FieldCoordinates;
import focalplane.sim.model.MissionGeometry;
import focalplane.sim.model.NormalizedFieldCoordinates;
import focalplane.sim.model.PixelCoordinates;
import focalplane.sim.model.Point;
import focalplane.sim.model.Quaternion;
import focalplane.sim.model.SkyCoordinates;
import focalplane.sim.model.TermKey;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the coordinate pipeline in {@link TransformationFunctions}, run against the bundled reference missions.
 */
class TransformationFunctionsTest {

    private static MissionGeometry single;
    private static MissionGeometry quad;
    private static MissionGeometry skewed;

    @BeforeAll
    static void loadMissions() {
        MissionConfigManager manager = MissionConfigManager.fromClasspath();
        single = manager.getMission("single");
        quad = manager.getMission("quad");

        double c = Math.cos(Math.toRadians(30.0));
        double s = Math.sin(Math.toRadians(30.0));
        skewed = new MissionGeometry.Builder()
                .name("skewed")
                .frameSize(640, 480)
                .pixelScale(1.5e-5, 0.8e-5)
                .focalLength(2.25)
                .pixelOrigin(3, -2)
                .referencePoint(2.0e-3, -1.5e-3)
                .detector(4.0e-3, 1.0e-3, c, -s, s, c)
                .detector(-6.0e-3, 2.5e-3, -s, c, c, s)
                .build();
    }

    // ==================== REFERENCE SCENARIO ====================

    @Test
    @DisplayName("Detector center maps to the optical axis and back")
    void testScenario_SingleDetectorCenter() {
        Point center = new Point(0.5, 0.5, 1.0);

        PixelCoordinates pixel = TransformationFunctions.denormalize(center, single);
        assertEquals(983.5, pixel.kappa(), 0.0);
        assertEquals(983.5, pixel.mu(), 0.0);

        FieldCoordinates field = TransformationFunctions.unproject(pixel, single, 0);
        assertEquals(0.0, field.eta(), 1e-15);
        assertEquals(0.0, field.zeta(), 1e-15);

        FieldCoordinates calibrated = TransformationFunctions.calibrate(center, new CalibrationModel(), single, 0);
        assertEquals(0.0, calibrated.eta(), 1e-15);
        assertEquals(0.0, calibrated.zeta(), 1e-15);

        PixelCoordinates back = TransformationFunctions.project(new FieldCoordinates(0.0, 0.0), single, 0);
        assertEquals(983.5, back.kappa(), 1e-12);
        assertEquals(983.5, back.mu(), 1e-12);
    }

    @Test
    void testDenormalize_UnitSquareCorners() {
        PixelCoordinates origin = TransformationFunctions.denormalize(0.0, 0.0, single);
        PixelCoordinates far = TransformationFunctions.denormalize(1.0, 1.0, single);

        assertEquals(7.5, origin.kappa(), 0.0);
        assertEquals(7.5, origin.mu(), 0.0);
        assertEquals(1959.5, far.kappa(), 0.0);
        assertEquals(1959.5, far.mu(), 0.0);
    }

    // ==================== ROUND TRIP ====================

    @ParameterizedTest
    @CsvSource({
            "0, 7.5, 7.5",
            "0, 1959.5, 1959.5",
            "1, 100.25, 1500.75",
            "2, 983.5, 12.0",
            "3, -5000.0, 4321.125",
            "3, 1.0e4, -2.5e3"
    })
    void testProjectUnproject_RoundTrip(int detector, double kappa, double mu) {
        PixelCoordinates pixel = new PixelCoordinates(kappa, mu);

        PixelCoordinates back = TransformationFunctions.project(
                TransformationFunctions.unproject(pixel, quad, detector), quad, detector);

        assertEquals(kappa, back.kappa(), 1e-9);
        assertEquals(mu, back.mu(), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({
            "0, 2.5, -2.5",
            "0, 642.5, 477.5",
            "1, 317.25, 101.75",
            "1, -900.0, 2048.5"
    })
    void testProjectUnproject_RoundTripOnRotatedAnisotropicDetector(int detector, double kappa, double mu) {
        assertTrue(skewed.isOrthogonal(detector));
        PixelCoordinates pixel = new PixelCoordinates(kappa, mu);

        FieldCoordinates field = TransformationFunctions.unproject(pixel, skewed, detector);
        PixelCoordinates back = TransformationFunctions.project(field, skewed, detector);

        assertEquals(kappa, back.kappa(), 1e-9);
        assertEquals(mu, back.mu(), 1e-9);
    }

    @Test
    void testUnproject_DetectorOffsetShiftsField() {
        PixelCoordinates center = TransformationFunctions.denormalize(0.5, 0.5, quad);

        FieldCoordinates field = TransformationFunctions.unproject(center, quad, 1);

        assertEquals(11.4e-3 / 4.3704, field.eta(), 1e-15);
        assertEquals(-11.4e-3 / 4.3704, field.zeta(), 1e-15);
    }

    // ==================== NORMALIZATION ====================

    @Test
    void testNormalize_CornersMapToUnitSquare() {
        for (int n = 0; n < quad.getDetectorCount(); n++) {
            FieldCoordinates min = TransformationFunctions.unproject(
                    TransformationFunctions.denormalize(0.0, 0.0, quad), quad, n);
            FieldCoordinates max = TransformationFunctions.unproject(
                    TransformationFunctions.denormalize(1.0, 1.0, quad), quad, n);
            FieldCoordinates mid = TransformationFunctions.unproject(
                    TransformationFunctions.denormalize(0.5, 0.5, quad), quad, n);

            NormalizedFieldCoordinates nMin = TransformationFunctions.normalize(min, quad, n);
            NormalizedFieldCoordinates nMax = TransformationFunctions.normalize(max, quad, n);
            NormalizedFieldCoordinates nMid = TransformationFunctions.normalize(mid, quad, n);

            assertEquals(0.0, nMin.etaTilde(), 1e-12);
            assertEquals(0.0, nMin.zetaTilde(), 1e-12);
            assertEquals(1.0, nMax.etaTilde(), 1e-12);
            assertEquals(1.0, nMax.zetaTilde(), 1e-12);
            assertEquals(0.5, nMid.etaTilde(), 1e-12);
            assertEquals(0.5, nMid.zetaTilde(), 1e-12);
        }
    }

    // ==================== CALIBRATION ====================

    @Test
    void testCalibrate_AllTermsDisabledEqualsUnproject() {
        CalibrationModel calibration = new CalibrationModel();
        for (TermKey key : TermKey.all()) {
            calibration.setEtaCoefficient(key, 1.0);
            calibration.setZetaCoefficient(key, -1.0);
        }
        calibration.setAllEnabled(false);
        Point point = new Point(0.13, 0.77, 3.0);

        for (int n = 0; n < quad.getDetectorCount(); n++) {
            FieldCoordinates expected = TransformationFunctions.unproject(
                    TransformationFunctions.denormalize(point, quad), quad, n);
            FieldCoordinates actual = TransformationFunctions.calibrate(point, calibration, quad, n);
            assertEquals(expected.eta(), actual.eta(), 0.0);
            assertEquals(expected.zeta(), actual.zeta(), 0.0);
        }
    }

    @Test
    @DisplayName("Calibration offset of term (1,0) follows zeta")
    void testCalibrate_AppliesTermsAtNormalizedPosition() {
        CalibrationModel calibration = new CalibrationModel();
        calibration.setEtaCoefficient(1, 0, 1.0);
        Point point = new Point(0.2, 0.6, 1.0);

        FieldCoordinates undistorted = TransformationFunctions.unproject(
                TransformationFunctions.denormalize(point, single), single, 0);
        NormalizedFieldCoordinates normalized = TransformationFunctions.normalize(undistorted, single, 0);
        FieldCoordinates distorted = TransformationFunctions.calibrate(point, calibration, single, 0);

        double expected = 2.0 * (normalized.zetaTilde() - 0.5) * 1e-3;
        assertEquals(undistorted.eta() + expected, distorted.eta(), 1e-15);
        assertEquals(undistorted.zeta(), distorted.zeta(), 0.0);
    }

    @Test
    void testPrepare_CachesResultOnPoint() {
        CalibrationModel calibration = new CalibrationModel();
        calibration.setZetaCoefficient(0, 0, 1.0);
        Point point = new Point(0.5, 0.5, 1.0);
        assertTrue(point.getDistortedNormalized().isEmpty());

        NormalizedFieldCoordinates prepared = TransformationFunctions.prepare(point, calibration, single, 0);

        assertEquals(Optional.of(prepared), point.getDistortedNormalized());
        assertEquals(0.5, prepared.etaTilde(), 1e-12);
        assertNotEquals(0.5, prepared.zetaTilde(), 1e-6);
    }

    // ==================== CLIP / OBSERVE ====================

    @Test
    void testClip_EdgesInclusive() {
        assertTrue(TransformationFunctions.clip(new PixelCoordinates(7.5, 7.5), single).isPresent());
        assertTrue(TransformationFunctions.clip(new PixelCoordinates(1959.5, 1959.5), single).isPresent());
        assertTrue(TransformationFunctions.clip(new PixelCoordinates(7.4999, 500.0), single).isEmpty());
        assertTrue(TransformationFunctions.clip(new PixelCoordinates(500.0, 1959.5001), single).isEmpty());
    }

    @Test
    void testClip_FollowsDetectorBoundsOfShiftedOrigin() {
        DetectorBounds bounds = skewed.getDetectorBounds();

        assertEquals(2.5, bounds.getMinKappa(), 0.0);
        assertEquals(-2.5, bounds.getMinMu(), 0.0);
        assertTrue(TransformationFunctions.clip(new PixelCoordinates(2.5, -2.5), skewed).isPresent());
        assertTrue(TransformationFunctions.clip(new PixelCoordinates(642.5, 477.5), skewed).isPresent());
        assertTrue(TransformationFunctions.clip(new PixelCoordinates(642.5001, 0.0), skewed).isEmpty());
        assertTrue(TransformationFunctions.clip(new PixelCoordinates(100.0, -2.5001), skewed).isEmpty());
    }

    @Test
    void testObservedPixel_SameGeometryReturnsOriginalPixel() {
        Point point = new Point(0.3, 0.7, 1.0);

        Optional<PixelCoordinates> observed = TransformationFunctions.observedPixel(
                point, new CalibrationModel(), single, 0, single, 0);

        assertTrue(observed.isPresent());
        assertEquals(0.3 * 1952 + 7.5, observed.get().kappa(), 1e-9);
        assertEquals(0.7 * 1952 + 7.5, observed.get().mu(), 1e-9);
    }

    @Test
    void testObservedPixel_EachQuadDetectorSeesItsOwnQuadrant() {
        CalibrationModel calibration = new CalibrationModel();
        Point onAxis = new Point(0.5, 0.5, 1.0);

        for (int n = 0; n < quad.getDetectorCount(); n++) {
            assertTrue(TransformationFunctions.observedPixel(onAxis, calibration, single, 0, quad, n).isEmpty(),
                    "detector " + n);
        }

        // field position of this point is the center of detector 0
        double offset = 11.4e-3 / (1952 * 1e-5);
        Point towardsFirst = new Point(0.5 - offset, 0.5 + offset, 1.0);
        assertTrue(TransformationFunctions.observedPixel(towardsFirst, calibration, single, 0, quad, 0).isPresent());
        assertTrue(TransformationFunctions.observedPixel(towardsFirst, calibration, single, 0, quad, 3).isEmpty());
    }

    // ==================== SKY ====================

    @Test
    void testSkyCoordinates_IdentityAttitudeKeepsField() {
        SkyCoordinates sky = TransformationFunctions.skyCoordinates(new FieldCoordinates(1.0e-3, -2.0e-3),
                Quaternion.IDENTITY);

        assertEquals(1.0e-3, sky.alpha(), 1e-15);
        assertEquals(-2.0e-3, sky.delta(), 1e-15);
    }

    @Test
    void testSkyCoordinates_AppliesInverseAttitude() {
        double half = Math.PI / 4;
        Quaternion attitude = new Quaternion(0.0, 0.0, Math.sin(half), Math.cos(half));

        SkyCoordinates sky = TransformationFunctions.skyCoordinates(new FieldCoordinates(0.1, 0.05), attitude);

        assertEquals(0.1 - Math.PI / 2, sky.alpha(), 1e-12);
        assertEquals(0.05, sky.delta(), 1e-12);
    }
}
