package focalplane.sim.service;

/**
 * One simulated observation: a catalog source seen by one detector in one exposure.
 *
 * @param exposureId exposure number, 1-based
 * @param detectorId detector number, 1-based
 * @param observationId running observation number, 1-based
 * @param sourceId catalog source number, 1-based, assigned on first observation
 * @param alpha sky longitude of the source, radians
 * @param delta sky latitude of the source, radians
 * @param kappa observed pixel column, shift and noise included
 * @param mu observed pixel row, shift and noise included
 */
public record Observation(int exposureId, int detectorId, int observationId, int sourceId,
                          double alpha, double delta, double kappa, double mu) {
}
