package converge.cvir;

import com.fasterxml.jackson.annotation.JsonValue;
import converge.diag.InternalCompilerError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code {"type": "Poisson", "rate": {...}, ...}}: the type-specific fields
 * sit next to {@code type} and {@code rate} rather than in a nested map.
 */
public record CvirStimulusModel(String type, CvirQuantity rate, Map<String, Object> fields) {

    public CvirStimulusModel {
        if (fields.containsKey("type") || fields.containsKey("rate")) {
            throw new InternalCompilerError("Stimulus field collides with 'type' or 'rate': " + fields.keySet());
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", type);
        out.put("rate", rate);
        out.putAll(fields);
        return out;
    }
}
