package converge.ast;

import converge.ast.item.Item;

import java.util.List;

/** Top-level items in source order; the order is meaningful downstream. */
public record Program(List<Item> items) {

    public Program {
        items = List.copyOf(items);
    }
}
