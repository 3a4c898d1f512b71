package focalplane.sim.service;

import focalplane.sim.model.OrderCoefficients;
import focalplane.sim.model.Quaternion;

import java.util.List;

/**
 * Output of {@link ObservationSimulator#simulate}.
 *
 * @param attitude attitude the catalog was placed on the sky with
 * @param catalog unique catalog sources, in catalog point order
 * @param observations observations in exposure, detector, point order
 * @param calibrationData effective calibration law of each exposure, in exposure order
 * @param observationCount number of observations (L)
 * @param sourceCount number of distinct observed sources (Lambda)
 */
public record SimulationResult(Quaternion attitude,
                               List<CatalogEntry> catalog,
                               List<Observation> observations,
                               List<List<OrderCoefficients>> calibrationData,
                               int observationCount,
                               int sourceCount) {

    public SimulationResult {
        catalog = List.copyOf(catalog);
        observations = List.copyOf(observations);
        calibrationData = List.copyOf(calibrationData);
    }
}
