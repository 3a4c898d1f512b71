package focalplane.sim.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable optical and detector geometry of one mission: a set of detectors sharing a common mounting frame
 * behind one focal length.
 *
 * <h3>Per-mission quantities</h3>
 * <ul>
 *   <li>pixel grid size {@code columns x rows}, pixel-space origin offset {@code (kappa0, mu0)}</li>
 *   <li>physical pixel scale {@code (scaleX, scaleY)} and focal length {@code F} (same length unit)</li>
 *   <li>reference point {@code (x0, y0)} of the focal plane shared by all detectors</li>
 * </ul>
 *
 * <h3>Per-detector quantities</h3>
 * <ul>
 *   <li>physical center offset {@code (xCenter[n], yCenter[n])}</li>
 *   <li>rotation row {@code R[n] = (R_etaKappa, R_etaMu, R_zetaKappa, R_zetaMu)}, a 2x2 orientation matrix
 *       flattened row-major</li>
 * </ul>
 *
 * <p>Zero or non-finite focal length and pixel scales are rejected by {@link Builder#build()}. Rotation rows are
 * expected to be orthogonal; a non-orthogonal row is accepted but logged, since the pixel/field round trip only
 * holds for orthogonal rows.</p>
 *
 * <p>Instances are created through {@link Builder}:</p>
 * <pre>{@code
 * MissionGeometry mission = new MissionGeometry.Builder()
 *     .name("single")
 *     .frameSize(1952, 1952)
 *     .pixelScale(1.0e-5, 1.0e-5)
 *     .focalLength(4.3704)
 *     .pixelOrigin(8, 8)
 *     .detector(0.0, 0.0, 0.0, 1.0, -1.0, 0.0)
 *     .build();
 * }</pre>
 *
 * @author Mike Nelson
 * @since 1.0
 */
public final class MissionGeometry {
    private static final Logger logger = LoggerFactory.getLogger(MissionGeometry.class);

    /** Tolerance of the orthogonality check on rotation rows. */
    public static final double ORTHOGONALITY_TOLERANCE = 1.0e-9;

    private String name = "mission";
    private int columns;
    private int rows;
    private double scaleX;
    private double scaleY;
    private double focalLength;
    private double kappa0;
    private double mu0;
    private double x0;
    private double y0;
    private double[] xCenter;
    private double[] yCenter;
    private double[][] rotation;
    private Quaternion attitude = Quaternion.IDENTITY;

    private MissionGeometry() {
    }

    /**
     * Builder for {@link MissionGeometry}. Setters log suspicious values; {@link #build()} rejects invalid ones.
     */
    public static class Builder {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);

        private final MissionGeometry mission = new MissionGeometry();
        private final List<double[]> detectors = new ArrayList<>();
        private Integer expectedDetectorCount;
        private boolean frameSet;
        private boolean scaleSet;
        private boolean focalLengthSet;

        public Builder name(String name) {
            logger.debug("Setting mission name: {}", name);
            mission.name = name;
            return this;
        }

        /**
         * Declares the number of detectors. Optional; when set, {@link #build()} checks it against the number
         * of {@link #detector} calls.
         *
         * @param count expected detector count
         * @return this builder
         */
        public Builder detectorCount(int count) {
            logger.debug("Setting expected detector count: {}", count);
            expectedDetectorCount = count;
            return this;
        }

        /**
         * @param columns pixel columns per detector
         * @param rows pixel rows per detector
         * @return this builder
         */
        public Builder frameSize(int columns, int rows) {
            logger.debug("Setting frame size: {}x{}", columns, rows);
            if (columns <= 0 || rows <= 0) {
                logger.warn("Frame size must be positive: {}x{} - this will cause build validation to fail",
                        columns, rows);
            }
            mission.columns = columns;
            mission.rows = rows;
            frameSet = true;
            return this;
        }

        /**
         * @param scaleX physical pixel size along mu
         * @param scaleY physical pixel size along kappa
         * @return this builder
         */
        public Builder pixelScale(double scaleX, double scaleY) {
            logger.debug("Setting pixel scale: {} x {}", scaleX, scaleY);
            mission.scaleX = scaleX;
            mission.scaleY = scaleY;
            scaleSet = true;
            return this;
        }

        public Builder focalLength(double focalLength) {
            logger.debug("Setting focal length: {}", focalLength);
            mission.focalLength = focalLength;
            focalLengthSet = true;
            return this;
        }

        /**
         * @param kappa0 pixel-space column origin
         * @param mu0 pixel-space row origin
         * @return this builder
         */
        public Builder pixelOrigin(double kappa0, double mu0) {
            mission.kappa0 = kappa0;
            mission.mu0 = mu0;
            return this;
        }

        /**
         * @param x0 focal-plane reference x shared across detectors
         * @param y0 focal-plane reference y shared across detectors
         * @return this builder
         */
        public Builder referencePoint(double x0, double y0) {
            mission.x0 = x0;
            mission.y0 = y0;
            return this;
        }

        /**
         * Appends one detector.
         *
         * @param xCenter physical center x of the detector
         * @param yCenter physical center y of the detector
         * @param rotation {@code R_etaKappa, R_etaMu, R_zetaKappa, R_zetaMu}
         * @return this builder
         */
        public Builder detector(double xCenter, double yCenter, double... rotation) {
            logger.debug("Adding detector {}: center=({}, {}), R={}",
                    detectors.size(), xCenter, yCenter, Arrays.toString(rotation));
            double[] entry = new double[2 + (rotation == null ? 0 : rotation.length)];
            entry[0] = xCenter;
            entry[1] = yCenter;
            if (rotation != null) {
                System.arraycopy(rotation, 0, entry, 2, rotation.length);
            }
            detectors.add(entry);
            return this;
        }

        public Builder attitude(Quaternion attitude) {
            logger.debug("Setting attitude: {}", attitude);
            mission.attitude = attitude;
            return this;
        }

        /**
         * Validates and returns the geometry.
         *
         * @return the immutable geometry
         * @throws IllegalStateException if any field is missing or invalid
         */
        public MissionGeometry build() {
            if (!frameSet || mission.columns <= 0 || mission.rows <= 0) {
                fail(String.format("Frame size must be set and positive: %dx%d", mission.columns, mission.rows));
            }
            if (!focalLengthSet || mission.focalLength == 0.0 || !Double.isFinite(mission.focalLength)) {
                fail("Focal length must be set, finite and non-zero: " + mission.focalLength);
            }
            if (!scaleSet || mission.scaleX == 0.0 || mission.scaleY == 0.0
                    || !Double.isFinite(mission.scaleX) || !Double.isFinite(mission.scaleY)) {
                fail(String.format("Pixel scale must be set, finite and non-zero: %s x %s",
                        mission.scaleX, mission.scaleY));
            }
            if (detectors.isEmpty()) {
                fail("Mission '" + mission.name + "' defines no detectors");
            }
            if (expectedDetectorCount != null && expectedDetectorCount != detectors.size()) {
                fail(String.format("Mission '%s' declares %d detectors but defines %d",
                        mission.name, expectedDetectorCount, detectors.size()));
            }
            if (mission.attitude == null) {
                fail("Attitude must not be null");
            }

            int n = detectors.size();
            mission.xCenter = new double[n];
            mission.yCenter = new double[n];
            mission.rotation = new double[n][];
            for (int i = 0; i < n; i++) {
                double[] entry = detectors.get(i);
                if (entry.length != 6) {
                    fail(String.format("Rotation row of detector %d must have 4 elements, got %d", i, entry.length - 2));
                }
                mission.xCenter[i] = entry[0];
                mission.yCenter[i] = entry[1];
                mission.rotation[i] = Arrays.copyOfRange(entry, 2, 6);
            }

            for (int i = 0; i < n; i++) {
                if (!mission.isOrthogonal(i)) {
                    logger.warn("Rotation row of detector {} in mission '{}' is not orthogonal: {}",
                            i, mission.name, Arrays.toString(mission.rotation[i]));
                }
            }

            logger.debug("Built mission '{}': {} detectors, {}x{} px, F={}", mission.name, n,
                    mission.columns, mission.rows, mission.focalLength);
            return mission;
        }

        private static void fail(String error) {
            logger.error("Mission validation failed: {}", error);
            throw new IllegalStateException(error);
        }
    }

    // ==================== ACCESSORS ====================

    public String getName() { return name; }
    public int getDetectorCount() { return xCenter.length; }
    public int getColumns() { return columns; }
    public int getRows() { return rows; }
    public double getScaleX() { return scaleX; }
    public double getScaleY() { return scaleY; }
    public double getFocalLength() { return focalLength; }
    public double getKappa0() { return kappa0; }
    public double getMu0() { return mu0; }
    public double getX0() { return x0; }
    public double getY0() { return y0; }
    public Quaternion getAttitude() { return attitude; }

    public double getXCenter(int detector) {
        checkDetector(detector);
        return xCenter[detector];
    }

    public double getYCenter(int detector) {
        checkDetector(detector);
        return yCenter[detector];
    }

    /**
     * @param detector detector index
     * @return copy of the rotation row {@code (R_etaKappa, R_etaMu, R_zetaKappa, R_zetaMu)}
     */
    public double[] getRotation(int detector) {
        checkDetector(detector);
        return rotation[detector].clone();
    }

    public double getREtaKappa(int detector) {
        checkDetector(detector);
        return rotation[detector][0];
    }

    public double getREtaMu(int detector) {
        checkDetector(detector);
        return rotation[detector][1];
    }

    public double getRZetaKappa(int detector) {
        checkDetector(detector);
        return rotation[detector][2];
    }

    public double getRZetaMu(int detector) {
        checkDetector(detector);
        return rotation[detector][3];
    }

    /**
     * @return pixel-space column of the detector center, {@code kappa0 + (columns - 1) / 2}
     */
    public double getKappaCenter() {
        return kappa0 + (columns - 1) / 2.0;
    }

    /**
     * @return pixel-space row of the detector center, {@code mu0 + (rows - 1) / 2}
     */
    public double getMuCenter() {
        return mu0 + (rows - 1) / 2.0;
    }

    /**
     * @return pixel bounds shared by all detectors of this mission
     */
    public DetectorBounds getDetectorBounds() {
        return new DetectorBounds(kappa0 - 0.5, mu0 - 0.5, kappa0 - 0.5 + columns, mu0 - 0.5 + rows);
    }

    /**
     * Checks that a detector's rotation rows and columns have unit length and are mutually orthogonal.
     *
     * @param detector detector index
     * @return true within {@link #ORTHOGONALITY_TOLERANCE}
     */
    public boolean isOrthogonal(int detector) {
        checkDetector(detector);
        double[] r = rotation[detector];
        double row0 = r[0] * r[0] + r[1] * r[1];
        double row1 = r[2] * r[2] + r[3] * r[3];
        double col0 = r[0] * r[0] + r[2] * r[2];
        double col1 = r[1] * r[1] + r[3] * r[3];
        double rowDot = r[0] * r[2] + r[1] * r[3];
        double colDot = r[0] * r[1] + r[2] * r[3];
        return Math.abs(row0 - 1.0) <= ORTHOGONALITY_TOLERANCE
                && Math.abs(row1 - 1.0) <= ORTHOGONALITY_TOLERANCE
                && Math.abs(col0 - 1.0) <= ORTHOGONALITY_TOLERANCE
                && Math.abs(col1 - 1.0) <= ORTHOGONALITY_TOLERANCE
                && Math.abs(rowDot) <= ORTHOGONALITY_TOLERANCE
                && Math.abs(colDot) <= ORTHOGONALITY_TOLERANCE;
    }

    private void checkDetector(int detector) {
        if (detector < 0 || detector >= xCenter.length) {
            throw new IllegalArgumentException(String.format(
                    "Detector index %d out of range for mission '%s' with %d detectors",
                    detector, name, xCenter.length));
        }
    }

    @Override
    public String toString() {
        return String.format("%s (%d detectors, %dx%d px, F=%s)", name, getDetectorCount(), columns, rows, focalLength);
    }
}
