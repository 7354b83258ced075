package converge.sema;

import converge.ast.Ident;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/** Name to first declaration, per {@link SymbolKind}. One table per validation run. */
public final class SymbolTable {
    private final Map<SymbolKind, Map<String, Ident>> scopes = new EnumMap<>(SymbolKind.class);

    public SymbolTable() {
        for (SymbolKind k : SymbolKind.values()) scopes.put(k, new HashMap<>());
    }

    /**
     * @return {@code null} if {@code name} was new, otherwise the earlier
     *         declaration it collides with (the table keeps the earlier one)
     */
    public Ident define(SymbolKind kind, Ident name) {
        return scopes.get(kind).putIfAbsent(name.name(), name);
    }

    public Ident lookup(SymbolKind kind, String name) {
        return scopes.get(kind).get(name);
    }

    public boolean isDefined(SymbolKind kind, String name) {
        return scopes.get(kind).containsKey(name);
    }
}
