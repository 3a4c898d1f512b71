package focalplane.sim.model;

import focalplane.sim.utilities.LatticeRequest;
import focalplane.sim.utilities.LatticeUtilities;
import focalplane.sim.utilities.TransformationFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * A named pattern of points seen through its own calibration: the catalog or one exposure of a simulation run.
 *
 * <p>An exposure owns its {@link CalibrationModel}; copies never share one. The lattice is generated from a
 * {@link LatticeRequest}; exposures generated from the same request hold identical patterns, which is what lets
 * an observation be matched back to the catalog by point index.</p>
 *
 * @author Mike Nelson
 * @since 1.1
 */
public class Exposure {
    private static final Logger logger = LoggerFactory.getLogger(Exposure.class);

    /** Two points closer than this on both logical axes are the same point. */
    public static final double DOUBLE_TOLERANCE = 1.0e-6;

    /** Scale of catalog and exposure patterns: three detector widths. */
    public static final double DEFAULT_SCALE = 3.0;

    private final String name;
    private final double scale;
    private final CalibrationModel calibration;
    private LatticeRequest request;
    private List<LatticeLine> lines = List.of();

    public Exposure(String name) {
        this(name, DEFAULT_SCALE);
    }

    public Exposure(String name, double scale) {
        this(name, scale, new CalibrationModel());
    }

    /**
     * @param name display name
     * @param scale range scaling factor of the pattern points
     * @param calibration calibration model, owned by this exposure from now on
     */
    public Exposure(String name, double scale, CalibrationModel calibration) {
        this.name = name;
        this.scale = scale;
        this.calibration = calibration;
    }

    public String getName() { return name; }

    public double getScale() { return scale; }

    public CalibrationModel getCalibration() { return calibration; }

    public List<LatticeLine> getLines() { return lines; }

    /**
     * Replaces the pattern with the lattice described by a request.
     *
     * @param request lattice parameters
     * @return this exposure
     */
    public Exposure generate(LatticeRequest request) {
        this.request = request;
        this.lines = LatticeUtilities.createLattice(request, scale);
        logger.debug("Generated {} for exposure '{}'", request, name);
        return this;
    }

    /**
     * Prepares every pattern point against the given geometry with this exposure's calibration.
     *
     * @param mission geometry
     * @param detector detector index
     */
    public void prepare(MissionGeometry mission, int detector) {
        for (LatticeLine line : lines) {
            for (Point point : line.points()) {
                TransformationFunctions.prepare(point, calibration, mission, detector);
            }
        }
    }

    /**
     * Flattens the pattern into its unique points. Points are compared on their logical coordinates within
     * {@link #DOUBLE_TOLERANCE}; the first occurrence in line order is kept.
     *
     * @return unique points in line order
     */
    public List<Point> flattenRemovingDoubles() {
        List<Point> result = new ArrayList<>();
        for (LatticeLine line : lines) {
            for (Point point : line.points()) {
                boolean contains = false;
                for (int k = 0; k < result.size() && !contains; k++) {
                    contains = result.get(k).coincidesWith(point, DOUBLE_TOLERANCE);
                }
                if (!contains) {
                    result.add(point);
                }
            }
        }
        return result;
    }

    /**
     * Counts the unique pattern points observed on a target detector.
     *
     * @param defaultMission geometry the calibration is applied with
     * @param defaultDetector detector of the default geometry
     * @param targetMission geometry producing the observations
     * @param targetDetector detector of the target geometry
     * @return number of unique points inside the target detector
     */
    public int countVisiblePoints(MissionGeometry defaultMission, int defaultDetector,
                                  MissionGeometry targetMission, int targetDetector) {
        int result = 0;
        for (Point point : flattenRemovingDoubles()) {
            if (TransformationFunctions.observedPixel(point, calibration, defaultMission, defaultDetector,
                    targetMission, targetDetector).isPresent()) {
                result++;
            }
        }
        return result;
    }

    /**
     * Creates a new exposure with the same scale, a deep copy of this calibration and, if this exposure has been
     * generated, the same lattice.
     *
     * @param newName name of the copy
     * @return the copy
     */
    public Exposure copyAs(String newName) {
        Exposure copy = new Exposure(newName, scale, calibration.copy());
        if (request != null) {
            copy.generate(request);
        }
        logger.info("Copied exposure '{}' as '{}'", name, newName);
        return copy;
    }

    /**
     * Expresses a detector's physical offset in the focal plane as the constant (0,0) term of this calibration,
     * so that the pattern lands where that detector sits.
     *
     * @param mission geometry supplying the detector center
     * @param detector detector index
     * @param centered if true, zero the constant term instead
     */
    public void placeOnDetector(MissionGeometry mission, int detector, boolean centered) {
        TermKey constant = new TermKey(0, 0);
        if (centered) {
            calibration.setEtaCoefficient(constant, 0.0);
            calibration.setZetaCoefficient(constant, 0.0);
            return;
        }
        double shiftScale = 1.0 / (mission.getFocalLength() * calibration.getOrderFactor(0));
        calibration.setEtaCoefficient(constant, (mission.getXCenter(detector) - mission.getX0()) * shiftScale);
        calibration.setZetaCoefficient(constant, (mission.getYCenter(detector) - mission.getY0()) * shiftScale);
        logger.debug("Placed exposure '{}' on detector {} of '{}'", name, detector, mission.getName());
    }

    @Override
    public String toString() {
        return String.format("Exposure[%s, scale=%s, %d lines]", name, scale, lines.size());
    }
}
