package converge.ast.item;

import converge.ast.Ident;
import converge.ast.expr.CallExpr;
import converge.ast.expr.Quantity;

import java.util.List;

/** {@code stimulus Layer = Poisson(rate = 20 Hz, ...)}. */
public record StimulusDef(
        Ident layer,
        Model model
) implements Item {

    /**
     * @param params named arguments other than {@code rate}, in source order
     */
    public record Model(Ident type, Quantity rate, List<CallExpr.NamedArg> params) {
        public Model {
            params = List.copyOf(params);
        }
    }
}
