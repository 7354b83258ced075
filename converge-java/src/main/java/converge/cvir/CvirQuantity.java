package converge.cvir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** {@code {"value": n, "unit": "ms"}}; {@code unit} is omitted when the literal had none. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"value", "unit"})
public record CvirQuantity(Number value, String unit) {

    public CvirQuantity {
        Objects.requireNonNull(value, "value");
    }
}
