package com.strata.support;

import com.strata.config.LifecycleProperties;
import com.strata.metrics.LifecycleMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;

public final class TestProperties {

    private TestProperties() {
    }

    /**
     * Defaults with every directory placed under {@code root}.
     */
    public static LifecycleProperties under(Path root) {
        LifecycleProperties properties = new LifecycleProperties();
        properties.getDirectories().setConfig(root.resolve("config"));
        properties.getDirectories().setState(root.resolve("state"));
        properties.getDirectories().setBackups(root.resolve("backups"));
        properties.getDirectories().setWork(root.resolve("work"));
        properties.setHistoryCapacity(20);
        return properties;
    }

    public static LifecycleMetrics metrics() {
        LifecycleMetrics metrics = new LifecycleMetrics(new SimpleMeterRegistry());
        metrics.init();
        return metrics;
    }
}
