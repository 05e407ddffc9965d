package work.lcod.pipeline.merge;

public enum OperationKind {
    /** Always replaces the node at the path. */
    SET,
    /** Writes the value only when nothing exists at the path yet. */
    PRESERVE
}
