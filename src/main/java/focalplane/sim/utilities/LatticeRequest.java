package focalplane.sim.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Request object encapsulating the parameters of a lattice pattern: a grid of horizontal and vertical lines of
 * points spanning the unit square, with optional phase noise along each line.
 *
 * <p>The phase noise is drawn once, when the request is built, so every exposure generated from the same request
 * carries the same pattern point for point. Noise values are uniform in {@code [-amplitude, amplitude]}, where the
 * amplitude is a fraction of the line length, and are consumed in line order (horizontal lines first).</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * LatticeRequest request = new LatticeRequest.Builder()
 *     .pointsPerLine(64)
 *     .lines(5, 5)          // rows, columns
 *     .phaseNoise(0.005)
 *     .seed(42L)
 *     .build();
 * }</pre>
 *
 * <p><strong>Builder Pattern Validation:</strong></p>
 * <ul>
 *   <li>At least 2 points per line</li>
 *   <li>At least 2 rows and 2 columns</li>
 *   <li>Phase-noise amplitude must be finite and non-negative</li>
 * </ul>
 *
 * @author Mike Nelson
 * @since 1.1
 */
public class LatticeRequest {
    private int pointsPerLine = 64;
    private int rows = 5;
    private int columns = 5;
    private double phaseNoiseAmplitude;
    private Long seed;
    private double[] phaseNoise;

    /**
     * Builder class for constructing LatticeRequest instances.
     */
    public static class Builder {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);
        private final LatticeRequest request = new LatticeRequest();
        private Random random;

        /**
         * @param count number of points on each line, at least 2
         * @return this builder instance for method chaining
         */
        public Builder pointsPerLine(int count) {
            logger.debug("Setting points per line: {}", count);
            if (count < 2) {
                logger.warn("Points per line must be at least 2, got: {} - this will cause build validation to fail", count);
            }
            request.pointsPerLine = count;
            return this;
        }

        /**
         * @param rows number of horizontal lines, at least 2
         * @param columns number of vertical lines, at least 2
         * @return this builder instance for method chaining
         */
        public Builder lines(int rows, int columns) {
            logger.debug("Setting line count: {} rows, {} columns", rows, columns);
            if (rows < 2 || columns < 2) {
                logger.warn("Lattice needs at least 2 rows and 2 columns: rows={}, columns={} - this will cause build validation to fail",
                        rows, columns);
            }
            request.rows = rows;
            request.columns = columns;
            return this;
        }

        /**
         * @param amplitude phase-noise amplitude as a fraction of the line length; 0 disables noise
         * @return this builder instance for method chaining
         */
        public Builder phaseNoise(double amplitude) {
            logger.debug("Setting phase noise amplitude: {}", amplitude);
            request.phaseNoiseAmplitude = amplitude;
            return this;
        }

        /**
         * Fixes the random seed of the phase noise so that the pattern is reproducible.
         *
         * @param seed random seed
         * @return this builder instance for method chaining
         */
        public Builder seed(long seed) {
            request.seed = seed;
            return this;
        }

        /**
         * Supplies the random source of the phase noise directly. Takes precedence over {@link #seed(long)}.
         *
         * @param random random source
         * @return this builder instance for method chaining
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        /**
         * Validates the parameters and draws the phase noise.
         *
         * @return the completed LatticeRequest
         * @throws IllegalStateException if any parameter is invalid
         */
        public LatticeRequest build() {
            if (request.pointsPerLine < 2) {
                fail("Points per line must be at least 2, got " + request.pointsPerLine);
            }
            if (request.rows < 2 || request.columns < 2) {
                fail(String.format("Lattice needs at least 2 rows and 2 columns: rows=%d, columns=%d",
                        request.rows, request.columns));
            }
            if (!(request.phaseNoiseAmplitude >= 0.0) || Double.isInfinite(request.phaseNoiseAmplitude)) {
                fail("Phase noise amplitude must be finite and non-negative: " + request.phaseNoiseAmplitude);
            }

            Random source = random != null ? random
                    : request.seed != null ? new Random(request.seed) : new Random();
            request.phaseNoise = new double[request.getPointCount()];
            if (request.phaseNoiseAmplitude > 0.0) {
                for (int i = 0; i < request.phaseNoise.length; i++) {
                    request.phaseNoise[i] = (source.nextDouble() * 2.0 - 1.0) * request.phaseNoiseAmplitude;
                }
            }

            logger.debug("Successfully built LatticeRequest: {}x{} lines, {} points per line, noise={}",
                    request.rows, request.columns, request.pointsPerLine, request.phaseNoiseAmplitude);
            return request;
        }

        private static void fail(String error) {
            logger.error("Build validation failed: {}", error);
            throw new IllegalStateException(error);
        }
    }

    private LatticeRequest() {}

    public int getPointsPerLine() { return pointsPerLine; }

    public int getRows() { return rows; }

    public int getColumns() { return columns; }

    public double getPhaseNoiseAmplitude() { return phaseNoiseAmplitude; }

    /**
     * @return total number of points over all lines, doubles included
     */
    public int getPointCount() {
        return (rows + columns) * pointsPerLine;
    }

    /**
     * @param index position in line order, horizontal lines first
     * @return phase noise of that point
     */
    public double getPhaseNoise(int index) {
        return phaseNoise[index];
    }

    @Override
    public String toString() {
        return String.format("LatticeRequest[%dx%d lines, %d points per line, noise=%s]",
                rows, columns, pointsPerLine, phaseNoiseAmplitude);
    }
}
