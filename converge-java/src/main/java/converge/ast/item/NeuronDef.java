package converge.ast.item;

import converge.ast.Assign;
import converge.ast.Ident;

import java.util.List;

public record NeuronDef(
        Ident name,
        List<Assign> body
) implements Item {

    public NeuronDef {
        body = List.copyOf(body);
    }
}
