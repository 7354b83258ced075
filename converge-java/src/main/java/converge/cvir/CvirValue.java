package converge.cvir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter values that are neither quantities nor strings. Params maps hold
 * {@link CvirQuantity}, {@link String}, {@link Ident} or {@link Call}.
 */
public final class CvirValue {
    private CvirValue() {}

    /** {@code {"ident": "Zero"}}. */
    public record Ident(String ident) {}

    /** {@code {"call": "Normal", "args": [...], "named": {...}}}. */
    @JsonPropertyOrder({"call", "args", "named"})
    public record Call(String call, List<Object> args, Map<String, Object> named) {
        public Call {
            args = List.copyOf(args);
            named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
        }
    }
}
