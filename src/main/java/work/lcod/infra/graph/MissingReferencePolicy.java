package work.lcod.infra.graph;

/**
 * What the scheduler does with a reference to an undeclared name.
 */
public enum MissingReferencePolicy {
    /** Report an error and drop the referencing declaration from the order. */
    ERROR,
    /** Insert a placeholder leaf; later phases report the reference if they reach it. */
    TOLERATE
}
