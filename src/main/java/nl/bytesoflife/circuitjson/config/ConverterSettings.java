package nl.bytesoflife.circuitjson.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable conversion settings: scale factors, label distances and the canonical
 * line-style and arrow-head tables.
 */
public final class ConverterSettings {

    public static final String ROOT = "circuit-json";

    private static volatile ConverterSettings cachedDefaults;

    private final String formatVersion;
    private final double scaleX;
    private final double scaleY;
    private final double sizeScale;
    private final StatementOrder statementOrder;
    private final String chainLabelDistance;
    private final String deviceLabelDistance;
    private final String shapeLabelDistance;
    private final Map<String, String> lineStyles;
    private final Map<String, String> arrowAliases;

    private ConverterSettings(Config config) {
        this.formatVersion = config.getString("format-version");
        this.scaleX = config.getDouble("scale.x");
        this.scaleY = config.getDouble("scale.y");
        this.sizeScale = config.getDouble("scale.size");
        this.statementOrder = config.getEnum(StatementOrder.class, "statement-order");
        this.chainLabelDistance = config.getString("label.chain-distance");
        this.deviceLabelDistance = config.getString("label.device-distance");
        this.shapeLabelDistance = config.getString("label.shape-distance");
        this.lineStyles = readTable(config, "line-styles");
        this.arrowAliases = readTable(config, "arrow-aliases");
    }

    /**
     * Builds settings from a resolved configuration containing the {@value #ROOT} block.
     */
    public static ConverterSettings from(Config config) {
        return new ConverterSettings(config.getConfig(ROOT));
    }

    /**
     * Settings backed by the classpath defaults only.
     */
    public static ConverterSettings defaults() {
        if (cachedDefaults == null) {
            synchronized (ConverterSettings.class) {
                if (cachedDefaults == null) {
                    cachedDefaults = from(ConfigFactory.defaultReference());
                }
            }
        }
        return cachedDefaults;
    }

    private static Map<String, String> readTable(Config config, String path) {
        Map<String, String> table = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : config.getObject(path).unwrapped().entrySet()) {
            table.put(entry.getKey(), String.valueOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(table);
    }

    public String getFormatVersion() { return formatVersion; }
    public double getScaleX() { return scaleX; }
    public double getScaleY() { return scaleY; }
    public double getSizeScale() { return sizeScale; }
    public StatementOrder getStatementOrder() { return statementOrder; }
    public String getChainLabelDistance() { return chainLabelDistance; }
    public String getDeviceLabelDistance() { return deviceLabelDistance; }
    public String getShapeLabelDistance() { return shapeLabelDistance; }
    public Map<String, String> getLineStyles() { return lineStyles; }
    public Map<String, String> getArrowAliases() { return arrowAliases; }

    @Override
    public String toString() {
        return "ConverterSettings{version=" + formatVersion + ", scale=(" + scaleX + ", " + scaleY +
                "), sizeScale=" + sizeScale + ", order=" + statementOrder +
                ", lineStyles=" + lineStyles.size() + ", arrowAliases=" + arrowAliases.size() + "}";
    }
}
