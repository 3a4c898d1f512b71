package focalplane.sim.utilities;

import focalplane.sim.model.LatticeLine;
import focalplane.sim.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates lattice patterns of points on the unit square.
 *
 * <p>A lattice is {@code rows} horizontal lines at {@code y = i / (rows - 1)} followed by {@code columns}
 * vertical lines at {@code x = i / (columns - 1)}. Each line holds {@code pointsPerLine} points at parameter
 * {@code t = i / (pointsPerLine - 1) + noise}, with {@code t} clamped to [0, 1]. Where a horizontal and a
 * vertical line cross without noise, both carry a point at the same position; see
 * {@code Exposure.flattenRemovingDoubles()}.</p>
 *
 * @author Mike Nelson
 * @since 1.1
 */
public final class LatticeUtilities {
    private static final Logger logger = LoggerFactory.getLogger(LatticeUtilities.class);

    private LatticeUtilities() {
    }

    /**
     * Creates the lattice described by a request.
     *
     * @param request lattice parameters and phase noise
     * @param scale range scaling factor of the created points; 1.0 spans one detector
     * @return horizontal lines followed by vertical lines
     */
    public static List<LatticeLine> createLattice(LatticeRequest request, double scale) {
        int n = request.getPointsPerLine();
        List<LatticeLine> result = new ArrayList<>(request.getRows() + request.getColumns());
        int noiseStart = 0;
        int clamped = 0;

        for (int i = 0; i < request.getRows(); i++) {
            double y = (double) i / (request.getRows() - 1);
            List<Point> line = new ArrayList<>(n);
            clamped += createLine(0.0, y, 1.0, y, request, noiseStart, scale, line);
            result.add(new LatticeLine(line, isMainLine(i, request.getRows())));
            noiseStart += n;
        }
        for (int i = 0; i < request.getColumns(); i++) {
            double x = (double) i / (request.getColumns() - 1);
            List<Point> line = new ArrayList<>(n);
            clamped += createLine(x, 0.0, x, 1.0, request, noiseStart, scale, line);
            result.add(new LatticeLine(line, isMainLine(i, request.getColumns())));
            noiseStart += n;
        }

        if (clamped > 0) {
            logger.warn("Phase noise pushed {} of {} lattice points past a line end; they were clamped",
                    clamped, request.getPointCount());
        }
        logger.debug("Created lattice of {} lines at scale {}", result.size(), scale);
        return result;
    }

    /**
     * @param index line index within its direction
     * @param count number of lines in that direction
     * @return true for the first, last and middle line
     */
    public static boolean isMainLine(int index, int count) {
        return index == 0 || index == count - 1 || index == count / 2;
    }

    private static int createLine(double x1, double y1, double x2, double y2, LatticeRequest request,
                                  int noiseStart, double scale, List<Point> out) {
        int last = request.getPointsPerLine() - 1;
        int clamped = 0;
        for (int i = 0; i <= last; i++) {
            double t = (double) i / last + request.getPhaseNoise(noiseStart + i);
            if (t < 0.0) {
                t = 0.0;
                clamped++;
            } else if (t > 1.0) {
                t = 1.0;
                clamped++;
            }
            out.add(new Point(lerp(x1, x2, t), lerp(y1, y2, t), scale));
        }
        return clamped;
    }

    private static double lerp(double a, double b, double t) {
        return a + t * (b - a);
    }
}
