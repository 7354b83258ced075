package converge.sema;

/** Each kind is its own namespace: a neuron and a layer may share a name. */
public enum SymbolKind {
    NEURON("neuron"),
    LAYER("layer");

    private final String label;

    SymbolKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
