package tribe.scheduler.model;

/**
 * Condition under which a dependency is considered satisfied.
 */
public enum DependencyType {
    /** Dependency finished with status COMPLETED */
    COMPLETION,
    /** Dependency has at least started (running or finished) */
    START,
    /** Dependency produced a result, optionally equal to an expected value */
    OUTPUT,
    /** An external resource is available */
    RESOURCE
}
