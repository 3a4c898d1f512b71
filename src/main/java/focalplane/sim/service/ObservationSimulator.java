package focalplane.sim.service;

import focalplane.sim.model.Exposure;
import focalplane.sim.model.MissionGeometry;
import focalplane.sim.model.OrderCoefficients;
import focalplane.sim.model.PixelCoordinates;
import focalplane.sim.model.Point;
import focalplane.sim.model.Quaternion;
import focalplane.sim.model.SkyCoordinates;
import focalplane.sim.utilities.TransformationFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Simulates the observations a focal plane records of a catalog over a series of exposures.
 *
 * <h3>Procedure</h3>
 * <ol>
 *   <li>Every unique catalog point is calibrated with the catalog's own model against the default geometry and
 *       placed on the sky with the given attitude.</li>
 *   <li>Exposure {@code i} of {@code E} (1-based) is displaced by a systematic pixel shift of magnitude
 *       {@code pixelShift} in direction {@code (i - 1) / E * 2pi}.</li>
 *   <li>For each target detector and each unique exposure point, the observed pixel is computed; points off the
 *       detector are skipped. Each hit gets Gaussian pixel noise of standard deviation {@code pixelNoise} on
 *       both axes and is recorded against the catalog source with the same point index.</li>
 * </ol>
 *
 * <p>Source ids are handed out on first observation, so sources never seen get none and the ids of the seen
 * ones are dense. The random source is injectable to make runs reproducible.</p>
 *
 * @author Mike Nelson
 * @since 1.1
 */
public class ObservationSimulator {
    private static final Logger logger = LoggerFactory.getLogger(ObservationSimulator.class);

    private final double pixelShift;
    private final double pixelNoise;
    private final Random random;

    /**
     * @param pixelShift magnitude of the per-exposure systematic shift, pixels
     * @param pixelNoise standard deviation of the per-observation noise, pixels
     */
    public ObservationSimulator(double pixelShift, double pixelNoise) {
        this(pixelShift, pixelNoise, new Random());
    }

    /**
     * @param pixelShift magnitude of the per-exposure systematic shift, pixels
     * @param pixelNoise standard deviation of the per-observation noise, pixels
     * @param random source of the Gaussian noise
     */
    public ObservationSimulator(double pixelShift, double pixelNoise, Random random) {
        if (!Double.isFinite(pixelShift) || !(pixelNoise >= 0.0) || Double.isInfinite(pixelNoise)) {
            throw new IllegalArgumentException(String.format(
                    "Pixel shift must be finite and pixel noise finite and non-negative: shift=%s, noise=%s",
                    pixelShift, pixelNoise));
        }
        this.pixelShift = pixelShift;
        this.pixelNoise = pixelNoise;
        this.random = random;
    }

    /**
     * Runs the simulation with the attitude configured on the default geometry.
     *
     * @param catalog catalog pattern; its calibration places the sources on the sky
     * @param exposures exposures to observe, in order
     * @param defaultMission geometry calibrations are applied with; also supplies the attitude
     * @param defaultDetector detector of the default geometry
     * @param targetMission geometry whose detectors record the observations
     * @return catalog, observations and per-exposure calibration data
     * @see #simulate(Exposure, List, MissionGeometry, int, MissionGeometry, Quaternion)
     */
    public SimulationResult simulate(Exposure catalog, List<Exposure> exposures,
                                     MissionGeometry defaultMission, int defaultDetector,
                                     MissionGeometry targetMission) {
        return simulate(catalog, exposures, defaultMission, defaultDetector, targetMission,
                defaultMission.getAttitude());
    }

    /**
     * Runs the simulation.
     *
     * @param catalog catalog pattern; its calibration places the sources on the sky
     * @param exposures exposures to observe, in order; their patterns must match the catalog point for point
     * @param defaultMission geometry calibrations are applied with
     * @param defaultDetector detector of the default geometry
     * @param targetMission geometry whose detectors record the observations
     * @param attitude attitude used to place the catalog on the sky
     * @return catalog, observations and per-exposure calibration data
     * @throws IllegalArgumentException if an exposure has more unique points than the catalog
     */
    public SimulationResult simulate(Exposure catalog, List<Exposure> exposures,
                                     MissionGeometry defaultMission, int defaultDetector,
                                     MissionGeometry targetMission, Quaternion attitude) {
        List<CatalogEntry> entries = buildCatalog(catalog, defaultMission, defaultDetector, attitude);
        int[] sourceIds = new int[entries.size()];

        List<Observation> observations = new ArrayList<>();
        List<List<OrderCoefficients>> calibrationData = new ArrayList<>(exposures.size());
        int srcId = 0;
        int obsId = 0;

        for (int i = 1; i <= exposures.size(); i++) {
            Exposure exposure = exposures.get(i - 1);
            List<Point> points = exposure.flattenRemovingDoubles();
            if (points.size() > entries.size()) {
                String error = String.format("Exposure '%s' has %d unique points but the catalog only %d",
                        exposure.getName(), points.size(), entries.size());
                logger.error(error);
                throw new IllegalArgumentException(error);
            }

            double angle = (double) (i - 1) / exposures.size() * 2.0 * Math.PI;
            double shiftKappa = pixelShift * Math.cos(angle);
            double shiftMu = pixelShift * Math.sin(angle);
            calibrationData.add(exposure.getCalibration().data());

            for (int n = 0; n < targetMission.getDetectorCount(); n++) {
                for (int j = 0; j < points.size(); j++) {
                    Optional<PixelCoordinates> pixel = TransformationFunctions.observedPixel(points.get(j),
                            exposure.getCalibration(), defaultMission, defaultDetector, targetMission, n);
                    if (pixel.isEmpty()) {
                        continue;
                    }
                    if (sourceIds[j] == 0) {
                        sourceIds[j] = ++srcId;
                    }
                    SkyCoordinates sky = entries.get(j).sky();
                    observations.add(new Observation(i, n + 1, ++obsId, sourceIds[j],
                            sky.alpha(), sky.delta(),
                            pixel.get().kappa() + shiftKappa + pixelNoise * random.nextGaussian(),
                            pixel.get().mu() + shiftMu + pixelNoise * random.nextGaussian()));
                }
            }
            logger.debug("Exposure {} '{}': shift=({}, {}), {} observations so far",
                    i, exposure.getName(), shiftKappa, shiftMu, obsId);
        }

        logger.info("Simulated {} observations of {} sources over {} exposures on '{}'",
                obsId, srcId, exposures.size(), targetMission.getName());
        return new SimulationResult(attitude, entries, observations, calibrationData, obsId, srcId);
    }

    /**
     * Places the unique catalog points on the sky.
     *
     * @param catalog catalog pattern
     * @param defaultMission geometry the calibration is applied with
     * @param defaultDetector detector of the default geometry
     * @param attitude attitude quaternion
     * @return one entry per unique catalog point
     */
    public List<CatalogEntry> buildCatalog(Exposure catalog, MissionGeometry defaultMission, int defaultDetector,
                                           Quaternion attitude) {
        List<Point> sources = catalog.flattenRemovingDoubles();
        List<CatalogEntry> entries = new ArrayList<>(sources.size());
        for (int j = 0; j < sources.size(); j++) {
            Point source = sources.get(j);
            SkyCoordinates sky = TransformationFunctions.skyCoordinates(
                    TransformationFunctions.calibrate(source, catalog.getCalibration(), defaultMission, defaultDetector),
                    attitude);
            entries.add(new CatalogEntry(j, source, sky));
        }
        logger.debug("Catalog '{}' holds {} unique sources", catalog.getName(), entries.size());
        return entries;
    }
}
