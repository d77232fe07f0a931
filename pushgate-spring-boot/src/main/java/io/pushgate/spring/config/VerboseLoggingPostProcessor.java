/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring.config;

import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Turns {@code pushgate.verbose=true} into DEBUG logging for {@code io.pushgate}. Runs after config data
 * is loaded (so the repository-local file counts) and before the logging system is initialised.
 */
public class VerboseLoggingPostProcessor implements EnvironmentPostProcessor, Ordered {
    static final String SOURCE_NAME = "pushgateVerbose";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        if (environment.getProperty("pushgate.verbose", Boolean.class, false)) {
            environment
                    .getPropertySources()
                    .addFirst(new MapPropertySource(SOURCE_NAME, Map.of("logging.level.io.pushgate", "DEBUG")));
        }
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
