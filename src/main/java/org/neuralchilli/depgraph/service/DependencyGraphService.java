package org.neuralchilli.depgraph.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.depgraph.config.DependencyGraphConfig;
import org.neuralchilli.depgraph.domain.AddOutcome;
import org.neuralchilli.depgraph.domain.AuditReport;
import org.neuralchilli.depgraph.domain.MutationResult;
import org.neuralchilli.depgraph.domain.RemoveOutcome;

import java.nio.file.Path;

/**
 * Store-backed entry point: each call loads the collection file, runs one
 * operation on it and writes it back only if the operation changed it.
 */
@ApplicationScoped
public class DependencyGraphService {

    @Inject
    TaskStore store;

    @Inject
    DependencyMutationService mutations;

    @Inject
    DependencyAuditService auditor;

    @Inject
    DependencyGraphConfig config;

    public MutationResult<AddOutcome> addDependency(String taskId, String dependsOnId, String type, AddOptions options) {
        return addDependency(defaultTasksFile(), taskId, dependsOnId, type, options);
    }

    public MutationResult<AddOutcome> addDependency(
            Path tasksFile,
            String taskId,
            String dependsOnId,
            String type,
            AddOptions options
    ) {
        return store.update(
                tasksFile,
                collection -> mutations.addDependency(collection, taskId, dependsOnId, type, options),
                result -> result.outcome().map(outcome -> !outcome.alreadyExists()).orElse(false)
        );
    }

    public MutationResult<RemoveOutcome> removeDependency(String taskId, String dependsOnId, RemoveOptions options) {
        return removeDependency(defaultTasksFile(), taskId, dependsOnId, options);
    }

    public MutationResult<RemoveOutcome> removeDependency(
            Path tasksFile,
            String taskId,
            String dependsOnId,
            RemoveOptions options
    ) {
        return store.update(
                tasksFile,
                collection -> mutations.removeDependency(collection, taskId, dependsOnId, options),
                result -> result.outcome().map(RemoveOutcome::existed).orElse(false)
        );
    }

    public AuditReport audit(AuditOptions options) {
        return audit(defaultTasksFile(), options);
    }

    /**
     * Audit the file; with auto-fix on, applied fixes are saved
     */
    public AuditReport audit(Path tasksFile, AuditOptions options) {
        return store.update(
                tasksFile,
                collection -> auditor.audit(collection, options),
                report -> report.fixesApplied() > 0
        );
    }

    private Path defaultTasksFile() {
        return Path.of(config.store().tasksFile());
    }
}
