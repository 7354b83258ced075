package converge.ast.item;

public sealed interface Item
        permits NeuronDef, LayerDef, ConnectDef, StimulusDef, RunStmt {}
