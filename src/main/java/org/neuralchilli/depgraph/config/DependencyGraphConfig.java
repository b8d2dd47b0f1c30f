package org.neuralchilli.depgraph.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Engine settings under the {@code depgraph} prefix.
 */
@ConfigMapping(prefix = "depgraph")
public interface DependencyGraphConfig {

    @WithName("audit")
    Audit audit();

    @WithName("store")
    Store store();

    @WithName("changelog")
    Changelog changelog();

    interface Audit {

        /**
         * Direct dependents at which a task counts as a bottleneck
         */
        @WithName("bottleneck-threshold")
        @WithDefault("3")
        int bottleneckThreshold();

        /**
         * Chain length, in tasks, at which a chain counts as long
         */
        @WithName("long-chain-threshold")
        @WithDefault("5")
        int longChainThreshold();

        /**
         * Lowest severity reported when the caller does not choose one:
         * critical, warning, info or all
         */
        @WithName("minimum-severity")
        @WithDefault("info")
        String minimumSeverity();
    }

    interface Store {

        @WithName("tasks-file")
        @WithDefault("data/tasks/tasks.json")
        String tasksFile();

        @WithName("lock-timeout")
        @WithDefault("10s")
        Duration lockTimeout();
    }

    interface Changelog {

        @WithName("file")
        @WithDefault("data/logs/dependencies.log")
        String file();

        @WithName("enabled")
        @WithDefault("true")
        boolean enabled();
    }
}
