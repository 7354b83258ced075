package converge.config;

import converge.cvir.CvirQuantity;
import converge.lexer.NumberLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Emitter settings. {@link #load()} reads {@value #RESOURCE} from the
 * classpath, then lets JVM system properties with the same keys override it.
 *
 * @param defaultStep step written into {@code run} items that have no {@code step} clause
 * @param defaultSeed seed written into {@code run} items that have no {@code seed} clause
 */
public record ConvergeConfig(boolean prettyPrint, CvirQuantity defaultStep, long defaultSeed) {
    private static final Logger log = LoggerFactory.getLogger(ConvergeConfig.class);

    public static final String RESOURCE = "converge.properties";

    public static final String KEY_PRETTY = "converge.cvir.pretty";
    public static final String KEY_DEFAULT_STEP = "converge.run.default-step";
    public static final String KEY_DEFAULT_SEED = "converge.run.default-seed";

    private static final ConvergeConfig DEFAULTS = new ConvergeConfig(true, new CvirQuantity(1L, "ms"), 0L);

    public ConvergeConfig {
        Objects.requireNonNull(defaultStep, "defaultStep");
        if (defaultSeed < 0) throw new IllegalArgumentException("defaultSeed must be non-negative");
    }

    public static ConvergeConfig defaults() {
        return DEFAULTS;
    }

    public static ConvergeConfig load() {
        Properties props = new Properties();
        try (InputStream in = ConvergeConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
            else log.debug("No {} on classpath, using built-in defaults", RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String key : new String[]{KEY_PRETTY, KEY_DEFAULT_STEP, KEY_DEFAULT_SEED}) {
            String override = System.getProperty(key);
            if (override != null) props.setProperty(key, override);
        }
        return fromProperties(props);
    }

    public static ConvergeConfig fromProperties(Properties props) {
        boolean pretty = DEFAULTS.prettyPrint;
        String p = trimmed(props, KEY_PRETTY);
        if (p != null) {
            if (!p.equalsIgnoreCase("true") && !p.equalsIgnoreCase("false")) {
                throw new IllegalArgumentException(KEY_PRETTY + ": expected true or false, got '" + p + "'");
            }
            pretty = Boolean.parseBoolean(p);
        }

        CvirQuantity step = DEFAULTS.defaultStep;
        String s = trimmed(props, KEY_DEFAULT_STEP);
        if (s != null) step = parseQuantity(KEY_DEFAULT_STEP, s);

        long seed = DEFAULTS.defaultSeed;
        String sd = trimmed(props, KEY_DEFAULT_SEED);
        if (sd != null) {
            try {
                seed = Long.parseLong(sd);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(KEY_DEFAULT_SEED + ": not an integer: '" + sd + "'", e);
            }
            if (seed < 0) throw new IllegalArgumentException(KEY_DEFAULT_SEED + ": must be non-negative");
        }

        return new ConvergeConfig(pretty, step, seed);
    }

    // "<number> [unit]", same literal forms as source text
    private static CvirQuantity parseQuantity(String key, String text) {
        String[] parts = text.split("\\s+");
        if (parts.length > 2 || !parts[0].matches("-?\\d+(\\.\\d+)?")
                || (parts.length == 2 && !parts[1].matches("[A-Za-z_][A-Za-z0-9_]*"))) {
            throw new IllegalArgumentException(key + ": expected '<number> [unit]', got '" + text + "'");
        }
        return new CvirQuantity(NumberLiterals.parse(parts[0]), parts.length == 2 ? parts[1] : null);
    }

    private static String trimmed(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }
}
