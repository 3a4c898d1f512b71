package focalplane.sim.utilities;

import focalplane.sim.model.CalibrationDelta;
import focalplane.sim.model.CalibrationModel;
import focalplane.sim.model.FieldCoordinates;
import focalplane.sim.model.MissionGeometry;
import focalplane.sim.model.NormalizedFieldCoordinates;
import focalplane.sim.model.PixelCoordinates;
import focalplane.sim.model.Point;
import focalplane.sim.model.Quaternion;
import focalplane.sim.model.SkyCoordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * TransformationFunctions - the coordinate pipeline between focal-plane pattern, detector pixels, angular field
 * and sky.
 *
 * <p>Coordinate Systems:
 * <ul>
 *   <li><b>Logical:</b> (x, y) of a {@link Point}, unit square spans one detector</li>
 *   <li><b>Pixel:</b> (kappa, mu) in pixels of a detector, pixel-center convention</li>
 *   <li><b>Field:</b> (eta, zeta) angular field coordinates in radians, undistorted or distorted</li>
 *   <li><b>Normalized field:</b> (etaTilde, zetaTilde), field rescaled to a detector's corner-to-corner span</li>
 *   <li><b>Sky:</b> (alpha, delta) after applying the inverse attitude rotation</li>
 * </ul>
 *
 * <p>Transform Chain:
 * <pre>
 * Logical --denormalize--&gt; Pixel --unproject--&gt; Field --normalize--&gt; Normalized field
 *                                                  |                        |
 *                                                  +-------- calibrate -----+
 *                                                  v
 *                                           Distorted field --project--&gt; Pixel --clip--&gt; observation
 *                                                  |
 *                                                  +--normalize--&gt; cached on Point (prepare)
 *                                                  +--skyCoordinates--&gt; Sky (catalog)
 * </pre>
 *
 * <p>Geometry and calibration are passed explicitly on each call and nothing here keeps state; the only write
 * is the cache {@link #prepare} leaves on its point. Points may be evaluated concurrently as long as nobody edits
 * the calibration meanwhile.</p>
 *
 * @author Mike Nelson
 * @since 1.0
 */
public final class TransformationFunctions {
    private static final Logger logger = LoggerFactory.getLogger(TransformationFunctions.class);

    private TransformationFunctions() {
    }

    // ==================== PIXEL SPACE ====================

    /**
     * Maps unit-square coordinates to the pixel space of a mission's detectors.
     * {@code kappa = k * columns + kappa0 - 0.5}, {@code mu = m * rows + mu0 - 0.5}.
     *
     * @param k normalized column coordinate
     * @param m normalized row coordinate
     * @param mission geometry supplying grid size and pixel origin
     * @return pixel coordinates
     */
    public static PixelCoordinates denormalize(double k, double m, MissionGeometry mission) {
        return new PixelCoordinates(
                k * mission.getColumns() + mission.getKappa0() - 0.5,
                m * mission.getRows() + mission.getMu0() - 0.5);
    }

    /**
     * Denormalizes the logical coordinates of a point.
     *
     * @param point point whose (x, y) are used as (k, m)
     * @param mission geometry supplying grid size and pixel origin
     * @return pixel coordinates
     */
    public static PixelCoordinates denormalize(Point point, MissionGeometry mission) {
        return denormalize(point.getX(), point.getY(), mission);
    }

    /**
     * Returns the pixel unchanged if it lies on the mission's detector area, edges included.
     *
     * @param pixel pixel coordinates
     * @param mission geometry supplying the detector bounds
     * @return the same pixel, or empty if it falls outside the detector
     */
    public static Optional<PixelCoordinates> clip(PixelCoordinates pixel, MissionGeometry mission) {
        return mission.getDetectorBounds().contains(pixel) ? Optional.of(pixel) : Optional.empty();
    }

    // ==================== FIELD SPACE ====================

    /**
     * Maps detector pixel coordinates to undistorted angular field coordinates.
     *
     * <pre>
     * eta  = (xCenter[n] - x0)/F + (R_etaKappa  * scaleY * (kappa - kappaC) + R_etaMu  * scaleX * (mu - muC)) / F
     * zeta = (yCenter[n] - y0)/F + (R_zetaKappa * scaleY * (kappa - kappaC) + R_zetaMu * scaleX * (mu - muC)) / F
     * </pre>
     *
     * @param pixel pixel coordinates on detector n
     * @param mission geometry
     * @param detector detector index n
     * @return field coordinates in radians
     */
    public static FieldCoordinates unproject(PixelCoordinates pixel, MissionGeometry mission, int detector) {
        double f = mission.getFocalLength();
        double dKappa = mission.getScaleY() * (pixel.kappa() - mission.getKappaCenter());
        double dMu = mission.getScaleX() * (pixel.mu() - mission.getMuCenter());

        double eta0 = (mission.getXCenter(detector) - mission.getX0()) / f;
        double zeta0 = (mission.getYCenter(detector) - mission.getY0()) / f;
        double eta1 = (mission.getREtaKappa(detector) * dKappa + mission.getREtaMu(detector) * dMu) / f;
        double zeta1 = (mission.getRZetaKappa(detector) * dKappa + mission.getRZetaMu(detector) * dMu) / f;

        return new FieldCoordinates(eta0 + eta1, zeta0 + zeta1);
    }

    /**
     * Maps angular field coordinates to the pixel space of detector n. Algebraic inverse of
     * {@link #unproject} for orthogonal rotation rows.
     *
     * <pre>
     * kappa = kappaC + (R_etaKappa * (eta*F - xCenter[n] + x0) + R_zetaKappa * (zeta*F - yCenter[n] + y0)) / scaleY
     * mu    = muC    + (R_etaMu    * (eta*F - xCenter[n] + x0) + R_zetaMu    * (zeta*F - yCenter[n] + y0)) / scaleX
     * </pre>
     *
     * @param field field coordinates in radians
     * @param mission geometry
     * @param detector detector index n
     * @return pixel coordinates, not clipped
     */
    public static PixelCoordinates project(FieldCoordinates field, MissionGeometry mission, int detector) {
        double f = mission.getFocalLength();
        double dx = field.eta() * f - mission.getXCenter(detector) + mission.getX0();
        double dy = field.zeta() * f - mission.getYCenter(detector) + mission.getY0();

        double kappa = mission.getKappaCenter()
                + (mission.getREtaKappa(detector) * dx + mission.getRZetaKappa(detector) * dy) / mission.getScaleY();
        double mu = mission.getMuCenter()
                + (mission.getREtaMu(detector) * dx + mission.getRZetaMu(detector) * dy) / mission.getScaleX();

        return new PixelCoordinates(kappa, mu);
    }

    /**
     * Rescales field coordinates so that detector n spans [0, 1] x [0, 1].
     *
     * <p>The bounds are the field images of the unit-square corners (0, 0) and (1, 1), so the rescale follows
     * the detector's orientation: an axis whose image runs backwards gets a negative span. The bounds are
     * recomputed on each call; they cost two unprojections.</p>
     *
     * @param field field coordinates
     * @param mission geometry
     * @param detector detector index n
     * @return normalized field coordinates, not clamped
     */
    public static NormalizedFieldCoordinates normalize(FieldCoordinates field, MissionGeometry mission, int detector) {
        FieldCoordinates min = unproject(denormalize(0.0, 0.0, mission), mission, detector);
        FieldCoordinates max = unproject(denormalize(1.0, 1.0, mission), mission, detector);
        return new NormalizedFieldCoordinates(
                (field.eta() - min.eta()) / (max.eta() - min.eta()),
                (field.zeta() - min.zeta()) / (max.zeta() - min.zeta()));
    }

    // ==================== CALIBRATION ====================

    /**
     * Applies a calibration model to a point seen through detector n.
     *
     * <p>The point is denormalized, unprojected and normalized; the model is evaluated at the normalized field
     * position and its offsets are added to the undistorted field coordinates.</p>
     *
     * @param point point to distort
     * @param calibration calibration model
     * @param mission geometry
     * @param detector detector index n
     * @return distorted field coordinates in radians
     */
    public static FieldCoordinates calibrate(Point point, CalibrationModel calibration,
                                             MissionGeometry mission, int detector) {
        FieldCoordinates field = unproject(denormalize(point, mission), mission, detector);
        CalibrationDelta delta = calibration.terms(normalize(field, mission, detector));
        FieldCoordinates distorted = delta.applyTo(field);

        logger.debug("Calibrate {} on '{}'/{}: {} -> {}", point, mission.getName(), detector, field, distorted);
        return distorted;
    }

    /**
     * Calibrates a point, normalizes the distorted field position and caches the result on the point.
     *
     * @param point point to prepare; its cached distorted position is overwritten
     * @param calibration calibration model
     * @param mission geometry
     * @param detector detector index n
     * @return the normalized distorted field coordinates that were cached
     */
    public static NormalizedFieldCoordinates prepare(Point point, CalibrationModel calibration,
                                                     MissionGeometry mission, int detector) {
        NormalizedFieldCoordinates result = normalize(calibrate(point, calibration, mission, detector), mission, detector);
        point.setDistortedNormalized(result);
        return result;
    }

    /**
     * Produces the pixel at which a distorted point is observed.
     *
     * <p>Calibration is applied with the default geometry, which keeps one distortion figure regardless of the
     * detector under test; the distorted field position is then projected and clipped against the target
     * geometry. This lets several physically distinct detectors share one distortion law.</p>
     *
     * @param point observed point
     * @param calibration calibration model
     * @param defaultMission geometry the calibration is defined against
     * @param defaultDetector detector of the default geometry
     * @param targetMission geometry producing the observation
     * @param targetDetector detector of the target geometry
     * @return observed pixel, or empty if the point falls outside the target detector
     */
    public static Optional<PixelCoordinates> observedPixel(Point point, CalibrationModel calibration,
                                                           MissionGeometry defaultMission, int defaultDetector,
                                                           MissionGeometry targetMission, int targetDetector) {
        FieldCoordinates distorted = calibrate(point, calibration, defaultMission, defaultDetector);
        PixelCoordinates pixel = project(distorted, targetMission, targetDetector);
        Optional<PixelCoordinates> observed = clip(pixel, targetMission);

        logger.debug("Observe {} on '{}'/{}: {} ({})", point, targetMission.getName(), targetDetector,
                pixel, observed.isPresent() ? "inside" : "outside");
        return observed;
    }

    // ==================== SKY ====================

    /**
     * Converts field coordinates to sky coordinates.
     *
     * <p>(eta, zeta) are treated as spherical angles and rotated by the inverse of the attitude quaternion.</p>
     *
     * @param field field coordinates in radians
     * @param attitude attitude quaternion, expected to be unit length
     * @return sky coordinates (alpha, delta) in radians
     */
    public static SkyCoordinates skyCoordinates(FieldCoordinates field, Quaternion attitude) {
        double[] rotated = attitude.inverse().rotateAngular(field.eta(), field.zeta());
        return new SkyCoordinates(rotated[0], rotated[1]);
    }
}
