package focalplane.sim.service;

import focalplane.sim.model.Exposure;
import focalplane.sim.model.FieldCoordinates;
import focalplane.sim.model.MissionGeometry;
import focalplane.sim.model.PixelCoordinates;
import focalplane.sim.model.Point;
import focalplane.sim.model.Quaternion;
import focalplane.sim.utilities.LatticeRequest;
import focalplane.sim.utilities.MissionConfigManager;
import focalplane.sim.utilities.TransformationFunctions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link ObservationSimulator}. The noise source is a mocked {@link Random}, which returns 0 unless
 * stubbed.
 */
@ExtendWith(MockitoExtension.class)
class ObservationSimulatorTest {

    private static MissionGeometry single;
    private static MissionGeometry quad;

    @Mock
    private Random random;

    private LatticeRequest request;
    private Exposure catalog;

    @BeforeAll
    static void loadMissions() {
        MissionConfigManager manager = MissionConfigManager.fromClasspath();
        single = manager.getMission("single");
        quad = manager.getMission("quad");
    }

    @BeforeEach
    void setUp() {
        // scale 0.8 keeps every point off the detector edges
        request = new LatticeRequest.Builder().pointsPerLine(5).lines(3, 3).build();
        catalog = new Exposure("Catalog", 0.8).generate(request);
    }

    @Test
    void testBuildCatalog_SkyPositionsOfUniquePoints() {
        ObservationSimulator simulator = new ObservationSimulator(0.0, 0.0, random);

        List<CatalogEntry> entries = simulator.buildCatalog(catalog, single, 0, Quaternion.IDENTITY);

        assertEquals(21, entries.size());
        CatalogEntry first = entries.get(0);
        FieldCoordinates field = TransformationFunctions.calibrate(first.point(), catalog.getCalibration(), single, 0);
        assertEquals(0, first.index());
        assertEquals(field.eta(), first.sky().alpha(), 1e-15);
        assertEquals(field.zeta(), first.sky().delta(), 1e-15);
    }

    @Test
    @DisplayName("Every point of every exposure is observed once on the single detector")
    void testSimulate_SingleDetectorAllVisible() {
        ObservationSimulator simulator = new ObservationSimulator(0.0, 0.0, random);
        List<Exposure> exposures = List.of(catalog.copyAs("Exposure 1"), catalog.copyAs("Exposure 2"));

        SimulationResult result = simulator.simulate(catalog, exposures, single, 0, single, Quaternion.IDENTITY);

        assertEquals(42, result.observationCount());
        assertEquals(21, result.sourceCount());
        assertEquals(42, result.observations().size());
        assertEquals(2, result.calibrationData().size());
        assertEquals(6, result.calibrationData().get(0).size());

        List<Point> points = exposures.get(0).flattenRemovingDoubles();
        for (int k = 0; k < result.observations().size(); k++) {
            Observation observation = result.observations().get(k);
            int j = k % 21;
            assertEquals(k + 1, observation.observationId());
            assertEquals(k / 21 + 1, observation.exposureId());
            assertEquals(1, observation.detectorId());
            assertEquals(j + 1, observation.sourceId());
            assertEquals(result.catalog().get(j).sky().alpha(), observation.alpha(), 0.0);

            PixelCoordinates expected = TransformationFunctions.denormalize(points.get(j), single);
            assertEquals(expected.kappa(), observation.kappa(), 1e-9);
            assertEquals(expected.mu(), observation.mu(), 1e-9);
        }
    }

    @Test
    void testSimulate_ShiftRotatesWithExposureAndNoiseIsAdded() {
        when(random.nextGaussian()).thenReturn(1.0);
        ObservationSimulator simulator = new ObservationSimulator(2.0, 0.5, random);
        List<Exposure> exposures = List.of(
                catalog.copyAs("Exposure 1"), catalog.copyAs("Exposure 2"),
                catalog.copyAs("Exposure 3"), catalog.copyAs("Exposure 4"));

        SimulationResult result = simulator.simulate(catalog, exposures, single, 0, single, Quaternion.IDENTITY);

        PixelCoordinates base = TransformationFunctions.denormalize(
                exposures.get(0).flattenRemovingDoubles().get(0), single);
        double[][] shifts = {{2.0, 0.0}, {0.0, 2.0}, {-2.0, 0.0}, {0.0, -2.0}};
        for (int e = 0; e < 4; e++) {
            Observation first = result.observations().get(e * 21);
            assertEquals(e + 1, first.exposureId());
            assertEquals(base.kappa() + shifts[e][0] + 0.5, first.kappa(), 1e-9);
            assertEquals(base.mu() + shifts[e][1] + 0.5, first.mu(), 1e-9);
        }
        verify(random, atLeastOnce()).nextGaussian();
    }

    @Test
    void testSimulate_PlacedExposureLandsOnItsQuadDetector() {
        ObservationSimulator simulator = new ObservationSimulator(0.0, 0.0, random);
        Exposure exposure = catalog.copyAs("Exposure 1");
        exposure.placeOnDetector(quad, 2, false);

        SimulationResult result = simulator.simulate(catalog, List.of(exposure), single, 0, quad, Quaternion.IDENTITY);

        assertEquals(21, result.observationCount());
        for (Observation observation : result.observations()) {
            assertEquals(3, observation.detectorId());
        }
        assertEquals(exposure.countVisiblePoints(single, 0, quad, 2), result.observationCount());
    }

    @Test
    void testSimulate_SourcesAreNumberedOnFirstObservation() {
        ObservationSimulator simulator = new ObservationSimulator(0.0, 0.0, random);
        // at scale 3 only the pattern center falls on the detector
        Exposure wide = new Exposure("Exposure 1", 3.0).generate(request);
        Exposure wideCatalog = new Exposure("Catalog", 3.0).generate(request);

        SimulationResult result = simulator.simulate(wideCatalog, List.of(wide), single, 0, single,
                Quaternion.IDENTITY);

        assertEquals(1, result.observationCount());
        assertEquals(1, result.sourceCount());
        Observation only = result.observations().get(0);
        assertEquals(1, only.sourceId());
        assertEquals(0.5, wideCatalog.flattenRemovingDoubles().get(7).getX(), 0.0);
    }

    @Test
    void testSimulate_DefaultsToAttitudeOfDefaultMission() {
        double half = Math.toRadians(20.0) / 2;
        Quaternion attitude = new Quaternion(0.0, 0.0, Math.sin(half), Math.cos(half));
        MissionGeometry pointed = new MissionGeometry.Builder()
                .name("pointed")
                .frameSize(single.getColumns(), single.getRows())
                .pixelScale(single.getScaleX(), single.getScaleY())
                .focalLength(single.getFocalLength())
                .pixelOrigin(single.getKappa0(), single.getMu0())
                .detector(single.getXCenter(0), single.getYCenter(0), single.getRotation(0))
                .attitude(attitude)
                .build();
        ObservationSimulator simulator = new ObservationSimulator(0.0, 0.0, random);
        List<Exposure> exposures = List.of(catalog.copyAs("Exposure 1"));

        SimulationResult configured = simulator.simulate(catalog, exposures, pointed, 0, single);
        SimulationResult explicit = simulator.simulate(catalog, exposures, pointed, 0, single, attitude);

        assertEquals(attitude, configured.attitude());
        for (int j = 0; j < configured.catalog().size(); j++) {
            assertEquals(explicit.catalog().get(j).sky(), configured.catalog().get(j).sky());
        }
        assertNotEquals(single.getAttitude(), configured.attitude());
    }

    @Test
    void testSimulate_ExposureLargerThanCatalogFails() {
        ObservationSimulator simulator = new ObservationSimulator(0.0, 0.0, random);
        Exposure larger = new Exposure("Exposure 1", 0.8)
                .generate(new LatticeRequest.Builder().pointsPerLine(5).lines(4, 4).build());

        assertThrows(IllegalArgumentException.class,
                () -> simulator.simulate(catalog, List.of(larger), single, 0, single, Quaternion.IDENTITY));
    }

    @Test
    void testConstructor_RejectsNegativeNoise() {
        assertThrows(IllegalArgumentException.class, () -> new ObservationSimulator(0.0, -1.0, random));
    }
}
