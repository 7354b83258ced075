package converge.ast.item;

import converge.ast.Assign;
import converge.ast.Ident;

import java.util.List;

public record ConnectDef(
        Ident from,
        Ident to,
        List<Assign> body
) implements Item {

    public ConnectDef {
        body = List.copyOf(body);
    }
}
