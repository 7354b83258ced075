package converge.cvir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Root of a CVIR document: {@code {"cvir_version": "0.2", "items": [...]}}. */
@JsonPropertyOrder({"cvir_version", "items"})
public record CvirDocument(
        @JsonProperty("cvir_version") String cvirVersion,
        List<CvirItem> items
) {

    public CvirDocument {
        items = List.copyOf(items);
    }
}
