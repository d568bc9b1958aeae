package tribe.scheduler.executor;

/**
 * Predicate deciding whether a named resource is available.
 * Consulted for RESOURCE dependencies.
 */
@FunctionalInterface
public interface ResourceAvailability {

    /** Used when nothing is wired in: every resource counts as available. */
    ResourceAvailability ALWAYS_AVAILABLE = resource -> true;

    boolean isAvailable(String resource);
}
