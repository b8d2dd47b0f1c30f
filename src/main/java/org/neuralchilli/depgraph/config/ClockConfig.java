package org.neuralchilli.depgraph.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Produces the clock used to stamp {@code updated_at}, counter and change log
 * timestamps. Tests replace it with a fixed clock.
 */
@ApplicationScoped
public class ClockConfig {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
