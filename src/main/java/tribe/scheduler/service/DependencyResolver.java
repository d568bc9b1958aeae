package tribe.scheduler.service;

import tribe.scheduler.executor.ResourceAvailability;
import tribe.scheduler.model.ExecutionStatus;
import tribe.scheduler.model.TaskDependency;
import tribe.scheduler.model.TaskExecution;
import tribe.scheduler.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether the dependencies of an execution are currently satisfied.
 *
 * All dependencies must hold. A dependency on an id the store does not know
 * is not satisfied. A FAILED or CANCELLED dependency never satisfies a
 * COMPLETION dependency, so the dependent waits until it is cancelled.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final ExecutionRepository store;
    private final ResourceAvailability resources;

    public DependencyResolver(ExecutionRepository store) {
        this(store, ResourceAvailability.ALWAYS_AVAILABLE);
    }

    public DependencyResolver(ExecutionRepository store, ResourceAvailability resources) {
        this.store = store;
        this.resources = resources != null ? resources : ResourceAvailability.ALWAYS_AVAILABLE;
    }

    public boolean isSatisfied(TaskExecution execution) {
        return areSatisfied(execution.dependencies());
    }

    public boolean areSatisfied(List<TaskDependency> dependencies) {
        for (TaskDependency dependency : dependencies) {
            if (!isSatisfied(dependency)) {
                log.trace("Dependency {} ({}) not satisfied", dependency.dependencyId(), dependency.type());
                return false;
            }
        }
        return true;
    }

    public boolean isSatisfied(TaskDependency dependency) {
        String id = dependency.dependencyId();
        return switch (dependency.type()) {
            case COMPLETION -> store.findCompleted(id)
                    .map(done -> done.status() == ExecutionStatus.COMPLETED)
                    .orElse(false);
            case START -> store.isRunning(id) || store.findCompleted(id).isPresent();
            case OUTPUT -> outputMatches(store.findResult(id), dependency.expectedValue());
            case RESOURCE -> resources.isAvailable(dependency.resourceKey());
        };
    }

    private static boolean outputMatches(Optional<String> result, String expectedValue) {
        if (result.isEmpty()) {
            return false;
        }
        return expectedValue == null || Objects.equals(result.get(), expectedValue);
    }
}
