package focalplane.sim.model;

import java.util.List;

/**
 * One line of a lattice pattern.
 *
 * @param points points along the line, in parameter order
 * @param mainLine true for the first, last and middle line of each direction
 */
public record LatticeLine(List<Point> points, boolean mainLine) {

    public LatticeLine {
        points = List.copyOf(points);
    }
}
