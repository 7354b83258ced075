package converge.ast.item;

import converge.ast.Ident;

public record LayerDef(
        Ident name,
        long size,
        Ident neuronType
) implements Item {}
