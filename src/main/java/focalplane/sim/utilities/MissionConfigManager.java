package focalplane.sim.utilities;

import focalplane.sim.model.MissionGeometry;
import focalplane.sim.model.Quaternion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MissionConfigManager
 *
 * <p>Loads and queries a YAML file of mission geometries:
 *   - Parses nested YAML into a Map&lt;String,Object&gt;.
 *   - Offers type safe getters (getDouble, getSection, getList, etc.).
 *   - Builds {@link MissionGeometry} instances by mission name.
 *   - Validates required keys and reports missing paths.
 *
 * <p>Expected layout:</p>
 * <pre>
 * missions:
 *   single:
 *     detectors: 1
 *     columns: 1952
 *     rows: 1952
 *     scaleX: 1.0e-5
 *     scaleY: 1.0e-5
 *     focalLength: 4.3704
 *     kappa0: 8
 *     mu0: 8
 *     x0: 0.0
 *     y0: 0.0
 *     xCenter: [0.0]
 *     yCenter: [0.0]
 *     rotation: [[0, 1, -1, 0]]
 *     attitude: [0, 0, 0, 1]     # optional
 * </pre>
 *
 * @author Mike Nelson
 * @since 1.1
 */
public class MissionConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(MissionConfigManager.class);

    /** Classpath location of the bundled reference missions. */
    public static final String DEFAULT_RESOURCE = "missions.yml";

    static final String MISSIONS = "missions";

    /** Keys every mission section must define. */
    static final List<String> REQUIRED_KEYS = List.of(
            "detectors", "columns", "rows", "scaleX", "scaleY", "focalLength",
            "kappa0", "mu0", "x0", "y0", "xCenter", "yCenter", "rotation");

    private final Map<String, Object> configData;
    private final String source;

    /**
     * Loads a mission file from disk.
     *
     * @param configPath filesystem path to the YAML file
     */
    public MissionConfigManager(Path configPath) {
        this.source = configPath.toString();
        this.configData = loadConfig(configPath);
        logger.info("Loaded {} missions from {}", getAvailableMissions().size(), source);
    }

    private MissionConfigManager(Map<String, Object> configData, String source) {
        this.configData = configData;
        this.source = source;
        logger.info("Loaded {} missions from {}", getAvailableMissions().size(), source);
    }

    /**
     * Loads the bundled reference missions ({@code single} and {@code quad}).
     *
     * @return a manager over the classpath resource {@value #DEFAULT_RESOURCE}
     */
    public static MissionConfigManager fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param resource classpath resource name
     * @return a manager over the given classpath resource
     */
    public static MissionConfigManager fromClasspath(String resource) {
        try (InputStream in = MissionConfigManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.error("Mission resource not found on classpath: {}", resource);
                throw new IllegalArgumentException("Mission resource not found on classpath: " + resource);
            }
            return new MissionConfigManager(parse(in, resource), "classpath:" + resource);
        } catch (IOException e) {
            logger.error("Error reading mission resource: {}", resource, e);
            throw new IllegalArgumentException("Error reading mission resource: " + resource, e);
        }
    }

    private static Map<String, Object> loadConfig(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException e) {
            logger.error("YAML file could not be read: {}", path, e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String source) {
        Yaml yaml = new Yaml();
        try {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            }
            logger.error("YAML root is not a map: {}", source);
        } catch (RuntimeException e) {
            logger.error("Error parsing YAML: {}", source, e);
        }
        return new LinkedHashMap<>();
    }

    // ==================== TYPED ACCESS ====================

    /**
     * Retrieve a deeply nested value from the configuration.
     *
     * @param keys sequence of keys (e.g., "missions", "quad", "focalLength")
     * @return the value at the end of the key path, or null if not found
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (int i = 0; i < keys.length; i++) {
            if (current instanceof Map<?, ?> map && map.containsKey(keys[i])) {
                current = map.get(keys[i]);
                continue;
            }
            logger.debug("Key '{}' not found at level {} of {}", keys[i], i, Arrays.toString(keys));
            return null;
        }
        return current;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    // ==================== MISSIONS ====================

    /**
     * @return names of all configured missions, in file order
     */
    public Set<String> getAvailableMissions() {
        Map<String, Object> missions = getSection(MISSIONS);
        return missions == null ? Set.of() : new LinkedHashSet<>(missions.keySet());
    }

    /**
     * Builds the geometry of a configured mission.
     *
     * @param name mission name under {@code missions}
     * @return validated geometry
     * @throws IllegalArgumentException if the mission or one of its keys is missing or inconsistent
     * @throws IllegalStateException if the values fail geometry validation
     */
    public MissionGeometry getMission(String name) {
        if (getSection(MISSIONS, name) == null) {
            logger.error("Mission '{}' not found in {}", name, source);
            throw new IllegalArgumentException("Mission '" + name + "' not found in " + source);
        }

        int count = requireInteger(name, "detectors");
        List<Object> xCenter = requireList(name, "xCenter");
        List<Object> yCenter = requireList(name, "yCenter");
        List<Object> rotation = requireList(name, "rotation");
        for (List<Object> list : List.of(xCenter, yCenter, rotation)) {
            if (list.size() != count) {
                String error = String.format("Mission '%s' declares %d detectors but a per-detector list has %d entries",
                        name, count, list.size());
                logger.error(error);
                throw new IllegalArgumentException(error);
            }
        }

        MissionGeometry.Builder builder = new MissionGeometry.Builder()
                .name(name)
                .detectorCount(count)
                .frameSize(requireInteger(name, "columns"), requireInteger(name, "rows"))
                .pixelScale(requireDouble(name, "scaleX"), requireDouble(name, "scaleY"))
                .focalLength(requireDouble(name, "focalLength"))
                .pixelOrigin(requireDouble(name, "kappa0"), requireDouble(name, "mu0"))
                .referencePoint(requireDouble(name, "x0"), requireDouble(name, "y0"));

        for (int n = 0; n < count; n++) {
            String path = MISSIONS + "/" + name + "/rotation/" + n;
            if (!(rotation.get(n) instanceof List<?> row)) {
                logger.error("Expected a list at {}", path);
                throw new IllegalArgumentException("Expected a list at " + path);
            }
            builder.detector(toDouble(xCenter.get(n), MISSIONS + "/" + name + "/xCenter/" + n),
                    toDouble(yCenter.get(n), MISSIONS + "/" + name + "/yCenter/" + n),
                    toDoubles(row, path));
        }

        List<Object> attitude = getList(MISSIONS, name, "attitude");
        if (attitude != null) {
            builder.attitude(Quaternion.of(toDoubles(attitude, MISSIONS + "/" + name + "/attitude")));
        }

        MissionGeometry mission = builder.build();
        logger.info("Loaded mission {}", mission);
        return mission;
    }

    /**
     * Validate that every mission defines all required keys.
     *
     * @return list of missing key paths (empty if the configuration is complete)
     */
    public List<String> validateConfiguration() {
        List<String> missing = new ArrayList<>();

        Map<String, Object> missions = getSection(MISSIONS);
        if (missions == null || missions.isEmpty()) {
            missing.add(MISSIONS + " (at least one required)");
        } else {
            for (String name : missions.keySet()) {
                for (String key : REQUIRED_KEYS) {
                    if (getConfigItem(MISSIONS, name, key) == null) {
                        missing.add(MISSIONS + "." + name + "." + key);
                    }
                }
            }
        }

        if (!missing.isEmpty()) {
            logger.error("Configuration validation failed. Missing: {}", missing);
        } else {
            logger.info("Configuration validation passed");
        }
        return missing;
    }

    private int requireInteger(String mission, String key) {
        Integer v = getInteger(MISSIONS, mission, key);
        if (v == null) {
            throw missingKey(mission, key);
        }
        if (getConfigItem(MISSIONS, mission, key) instanceof Number n && n.doubleValue() != v) {
            String path = MISSIONS + "/" + mission + "/" + key;
            logger.error("Expected an integer at {} but got {}", path, n);
            throw new IllegalArgumentException("Expected an integer at " + path + " but got " + n);
        }
        return v;
    }

    private double requireDouble(String mission, String key) {
        Double v = getDouble(MISSIONS, mission, key);
        if (v == null) {
            throw missingKey(mission, key);
        }
        return v;
    }

    private List<Object> requireList(String mission, String key) {
        List<Object> v = getList(MISSIONS, mission, key);
        if (v == null) {
            throw missingKey(mission, key);
        }
        return v;
    }

    private static IllegalArgumentException missingKey(String mission, String key) {
        String path = MISSIONS + "/" + mission + "/" + key;
        logger.error("Missing or invalid configuration key: {}", path);
        return new IllegalArgumentException("Missing or invalid configuration key: " + path);
    }

    private static double toDouble(Object value, String path) {
        if (value instanceof Number n) return n.doubleValue();
        logger.error("Expected a number at {} but got {}", path, value);
        throw new IllegalArgumentException("Expected a number at " + path + " but got " + value);
    }

    private static double[] toDoubles(List<?> values, String path) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = toDouble(values.get(i), path + "/" + i);
        }
        return result;
    }
}
