package focalplane.sim.service;

import focalplane.sim.model.Point;
import focalplane.sim.model.SkyCoordinates;

/**
 * A catalog source: a unique point of the catalog pattern and its sky position.
 *
 * @param index position of the point among the unique catalog points
 * @param point the catalog pattern point
 * @param sky sky coordinates of the calibrated point
 */
public record CatalogEntry(int index, Point point, SkyCoordinates sky) {
}
