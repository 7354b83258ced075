package converge.cvir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lowered item. Serialised with a leading {@code "kind"} discriminator.
 * The neuron, layer and connect shapes are frozen since schema 0.1; run and
 * stimulus changed in 0.2.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CvirItem.Run.class, name = "run"),
        @JsonSubTypes.Type(value = CvirItem.Stimulus.class, name = "stimulus"),
        @JsonSubTypes.Type(value = CvirItem.Neuron.class, name = "neuron"),
        @JsonSubTypes.Type(value = CvirItem.Layer.class, name = "layer"),
        @JsonSubTypes.Type(value = CvirItem.Connect.class, name = "connect")
})
public sealed interface CvirItem {

    @JsonTypeName("run")
    @JsonPropertyOrder({"duration", "step", "seed"})
    record Run(CvirQuantity duration, CvirQuantity step, long seed) implements CvirItem {}

    @JsonTypeName("stimulus")
    @JsonPropertyOrder({"layer", "model"})
    record Stimulus(String layer, CvirStimulusModel model) implements CvirItem {}

    @JsonTypeName("neuron")
    @JsonPropertyOrder({"name", "params"})
    record Neuron(String name, Map<String, Object> params) implements CvirItem {
        public Neuron {
            params = freeze(params);
        }
    }

    @JsonTypeName("layer")
    @JsonPropertyOrder({"name", "size", "neuron_type"})
    record Layer(
            String name,
            long size,
            @JsonProperty("neuron_type") String neuronType
    ) implements CvirItem {}

    @JsonTypeName("connect")
    @JsonPropertyOrder({"from", "to", "params"})
    record Connect(String from, String to, Map<String, Object> params) implements CvirItem {
        public Connect {
            params = freeze(params);
        }
    }

    // insertion order is part of the output
    static Map<String, Object> freeze(Map<String, Object> m) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
}
