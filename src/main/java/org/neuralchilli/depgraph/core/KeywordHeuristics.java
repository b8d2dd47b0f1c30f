package org.neuralchilli.depgraph.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.depgraph.domain.Task;
import org.neuralchilli.depgraph.domain.TaskStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Title and description keyword matching used to guess whether an edge
 * reflects a real ordering between two tasks. Matching is case-insensitive
 * substring matching; these are hints, never hard rules.
 */
@ApplicationScoped
public class KeywordHeuristics {

    static final List<String> SETUP_KEYWORDS = List.of("setup", "configure", "install", "initialize");
    static final List<String> DESIGN_KEYWORDS = List.of("design", "architecture", "plan");
    static final List<String> COMPONENT_KEYWORDS =
            List.of("database", "api", "service", "interface", "component", "module", "system");

    /**
     * Whether {@code task} plausibly has to wait for {@code dependency}.
     *
     * @return the reason when the edge looks logically required
     */
    public Optional<String> inferLogicalDependency(Task task, Task dependency) {
        String taskTitle = lower(task.title());
        String dependencyTitle = lower(dependency.title());

        if (containsAny(dependencyTitle, SETUP_KEYWORDS)
                && (taskTitle.contains("implement") || taskTitle.contains("develop"))) {
            return Optional.of("Setup/configuration tasks typically should complete before implementation");
        }

        if (containsAny(dependencyTitle, DESIGN_KEYWORDS)
                && (taskTitle.contains("implement") || taskTitle.contains("build"))) {
            return Optional.of("Design tasks should typically complete before implementation");
        }

        List<String> shared = sharedComponents(task, dependency);
        if (!shared.isEmpty()) {
            return Optional.of("Tasks share common components: " + String.join(", ", shared));
        }

        return Optional.empty();
    }

    /**
     * A testing task depending on an implementation task is often backwards
     */
    public boolean isQuestionableOrder(Task task, Task dependency) {
        String taskTitle = lower(task.title());
        String dependencyTitle = lower(dependency.title());
        return taskTitle.contains("test")
                && (dependencyTitle.contains("implement") || dependencyTitle.contains("develop"));
    }

    /**
     * Implementation marked completed while the setup it depends on is still pending
     */
    public boolean isImplementationAheadOfSetup(Task task, Task dependency) {
        String taskTitle = lower(task.title());
        String dependencyTitle = lower(dependency.title());
        return taskTitle.contains("implement")
                && (dependencyTitle.contains("setup") || dependencyTitle.contains("configure"))
                && task.hasStatus(TaskStatus.COMPLETED)
                && dependency.hasStatus(TaskStatus.PENDING);
    }

    /**
     * Component keywords mentioned by both tasks (title or description)
     */
    public List<String> sharedComponents(Task task, Task dependency) {
        String taskText = lower(task.title()) + " " + lower(task.description());
        String dependencyText = lower(dependency.title()) + " " + lower(dependency.description());

        List<String> shared = new ArrayList<>();
        for (String component : COMPONENT_KEYWORDS) {
            if (taskText.contains(component) && dependencyText.contains(component)) {
                shared.add(component);
            }
        }
        return shared;
    }

    /**
     * Skills required by both tasks
     */
    public List<String> sharedSkills(Task task, Task dependency) {
        return task.skills().stream()
                .filter(dependency.skills()::contains)
                .distinct()
                .toList();
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
