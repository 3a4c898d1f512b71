package focalplane.sim.utilities;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import focalplane.sim.model.CalibrationModel;
import focalplane.sim.model.OrderCoefficients;
import focalplane.sim.model.TermKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes {@link CalibrationModel} state as JSON.
 *
 * <p>Document layout:</p>
 * <pre>
 * {
 *   "orderScale": [-2, -3, -4, -4, -5, -6],
 *   "enabled":   { "00": true, "01": true, ... "50": true },
 *   "etaCoeff":  { "00": 0.0, ... },
 *   "zetaCoeff": { "00": 0.0, ... }
 * }
 * </pre>
 *
 * <p>Older documents stored each order scale as a {@code [mantissa, exponent]} pair; only the exponent is
 * significant and such entries are read transparently. Reading is strict otherwise: every field, every order
 * and every one of the 21 term keys must be present.</p>
 *
 * @author Mike Nelson
 * @since 1.1
 */
public class CalibrationSerializer {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationSerializer.class);

    static final String ORDER_SCALE = "orderScale";
    static final String ENABLED = "enabled";
    static final String ETA_COEFF = "etaCoeff";
    static final String ZETA_COEFF = "zetaCoeff";

    private final Gson gson;

    public CalibrationSerializer() {
        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .create();
    }

    // ==================== WRITE ====================

    /**
     * @param model calibration model
     * @return the model state as a JSON tree
     * @throws IllegalArgumentException if a coefficient is NaN or infinite, which JSON cannot carry
     */
    public JsonObject toJsonTree(CalibrationModel model) {
        JsonObject root = new JsonObject();

        JsonArray scales = new JsonArray();
        for (int scale : model.getOrderScales()) {
            scales.add(scale);
        }
        root.add(ORDER_SCALE, scales);

        JsonObject enabled = new JsonObject();
        JsonObject eta = new JsonObject();
        JsonObject zeta = new JsonObject();
        for (TermKey key : TermKey.all()) {
            enabled.addProperty(key.identifier(), model.isEnabled(key));
            eta.addProperty(key.identifier(), requireFinite(ETA_COEFF, key, model.getEtaCoefficient(key)));
            zeta.addProperty(key.identifier(), requireFinite(ZETA_COEFF, key, model.getZetaCoefficient(key)));
        }
        root.add(ENABLED, enabled);
        root.add(ETA_COEFF, eta);
        root.add(ZETA_COEFF, zeta);
        return root;
    }

    /**
     * @param model calibration model
     * @return pretty-printed JSON document
     */
    public String toJson(CalibrationModel model) {
        return gson.toJson(toJsonTree(model));
    }

    /**
     * Serializes the effective calibration law returned by {@link CalibrationModel#data()}.
     *
     * @param model calibration model
     * @return JSON array with one object per order, keyed {@code eta<rs>} / {@code zeta<rs>}
     */
    public String toDataJson(CalibrationModel model) {
        return toDataJson(model.data());
    }

    /**
     * @param data per-order coefficient export
     * @return JSON array with one object per order
     */
    public String toDataJson(List<OrderCoefficients> data) {
        JsonArray array = new JsonArray();
        for (OrderCoefficients order : data) {
            JsonObject entry = new JsonObject();
            order.coefficients().forEach(entry::addProperty);
            array.add(entry);
        }
        return gson.toJson(array);
    }

    /**
     * Writes the model to a file, replacing any existing content.
     *
     * @param model calibration model
     * @param file target file
     * @throws IOException if the file cannot be written
     */
    public void save(CalibrationModel model, Path file) throws IOException {
        Files.writeString(file, toJson(model));
        logger.info("Saved calibration to {}", file);
    }

    // ==================== READ ====================

    /**
     * Rebuilds a model from its JSON document.
     *
     * @param json JSON document
     * @return a new model holding the stored state
     * @throws CalibrationFormatException if the document is malformed or incomplete
     */
    public CalibrationModel fromJson(String json) throws CalibrationFormatException {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            logger.error("Calibration document is not valid JSON", e);
            throw new CalibrationFormatException("Calibration document is not valid JSON", e);
        }
        if (parsed == null || !parsed.isJsonObject()) {
            throw fail("Calibration document must be a JSON object");
        }
        JsonObject root = parsed.getAsJsonObject();

        JsonArray scales = requireArray(root, ORDER_SCALE);
        JsonObject enabled = requireObject(root, ENABLED);
        JsonObject eta = requireObject(root, ETA_COEFF);
        JsonObject zeta = requireObject(root, ZETA_COEFF);

        if (scales.size() != CalibrationModel.HIGHEST_ORDER + 1) {
            throw fail(String.format("'%s' must have %d entries, found %d",
                    ORDER_SCALE, CalibrationModel.HIGHEST_ORDER + 1, scales.size()));
        }

        CalibrationModel model = new CalibrationModel();
        for (int o = 0; o <= CalibrationModel.HIGHEST_ORDER; o++) {
            model.setOrderScale(o, readExponent(scales.get(o), o));
        }
        for (TermKey key : TermKey.all()) {
            model.setEnabled(key, readBoolean(enabled, ENABLED, key));
            model.setEtaCoefficient(key, readNumber(eta, ETA_COEFF, key));
            model.setZetaCoefficient(key, readNumber(zeta, ZETA_COEFF, key));
        }

        logger.info("Deserialized calibration: {}", model);
        return model;
    }

    /**
     * Reads a model from a file.
     *
     * @param file JSON document
     * @return a new model holding the stored state
     * @throws IOException if the file cannot be read; {@link CalibrationFormatException} if it is malformed
     */
    public CalibrationModel load(Path file) throws IOException {
        logger.info("Loading calibration from {}", file);
        return fromJson(Files.readString(file));
    }

    private static int readExponent(JsonElement entry, int order) throws CalibrationFormatException {
        try {
            if (entry.isJsonArray()) {
                // legacy [mantissa, exponent]
                JsonArray pair = entry.getAsJsonArray();
                if (pair.size() != 2) {
                    throw fail(String.format("Order %d scale pair must be [mantissa, exponent]", order));
                }
                return exactInt(pair.get(1), order);
            }
            return exactInt(entry, order);
        } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            logger.error("Order {} scale is not an integer: {}", order, entry);
            throw new CalibrationFormatException("Order " + order + " scale is not an integer: " + entry, e);
        }
    }

    private static int exactInt(JsonElement element, int order) throws CalibrationFormatException {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw fail(String.format("Order %d scale must be a number, found %s", order, element));
        }
        double value = element.getAsDouble();
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw fail(String.format("Order %d scale must be an integer exponent, found %s", order, element));
        }
        return (int) value;
    }

    private static boolean readBoolean(JsonObject map, String field, TermKey key) throws CalibrationFormatException {
        JsonPrimitive value = requirePrimitive(map, field, key);
        if (!value.isBoolean()) {
            throw fail(String.format("'%s.%s' must be true or false, found %s", field, key.identifier(), value));
        }
        return value.getAsBoolean();
    }

    private static double readNumber(JsonObject map, String field, TermKey key) throws CalibrationFormatException {
        JsonPrimitive value = requirePrimitive(map, field, key);
        if (!value.isNumber()) {
            throw fail(String.format("'%s.%s' must be a number, found %s", field, key.identifier(), value));
        }
        double number = value.getAsDouble();
        if (!Double.isFinite(number)) {
            throw fail(String.format("'%s.%s' must be finite, found %s", field, key.identifier(), value));
        }
        return number;
    }

    private static double requireFinite(String field, TermKey key, double value) {
        if (!Double.isFinite(value)) {
            String error = String.format("'%s.%s' is %s and cannot be written as JSON", field, key.identifier(), value);
            logger.error(error);
            throw new IllegalArgumentException(error);
        }
        return value;
    }

    private static JsonPrimitive requirePrimitive(JsonObject map, String field, TermKey key)
            throws CalibrationFormatException {
        JsonElement value = map.get(key.identifier());
        if (value == null || !value.isJsonPrimitive()) {
            throw fail(String.format("'%s' is missing term '%s'", field, key.identifier()));
        }
        return value.getAsJsonPrimitive();
    }

    private static JsonArray requireArray(JsonObject root, String field) throws CalibrationFormatException {
        JsonElement value = root.get(field);
        if (value == null || !value.isJsonArray()) {
            throw fail("Missing array field '" + field + "'");
        }
        return value.getAsJsonArray();
    }

    private static JsonObject requireObject(JsonObject root, String field) throws CalibrationFormatException {
        JsonElement value = root.get(field);
        if (value == null || !value.isJsonObject()) {
            throw fail("Missing object field '" + field + "'");
        }
        return value.getAsJsonObject();
    }

    private static CalibrationFormatException fail(String error) {
        logger.error("Calibration format error: {}", error);
        return new CalibrationFormatException(error);
    }
}
