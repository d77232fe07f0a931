/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring;

import static org.junit.jupiter.api.Assertions.*;

import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.api.model.ScanMode;
import io.pushgate.core.preset.ScanPolicy;
import io.pushgate.spring.cli.PushgateCommandRunner;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
    "pushgate.scanner.mode=full",
    "pushgate.scanner.excluded-paths=generated/,third_party/",
    "pushgate.hook.large-file-max-mb=5",
    "pushgate.pin.resolve-timeout=5s"
})
class PushgateApplicationTest {

    @Autowired
    PushgateProperties props;

    @Autowired
    ScanPolicy policy;

    @Autowired
    PushgateCommandRunner runner;

    @Test
    void bindsPropertiesIntoTheEngine() {
        assertEquals(ScanMode.FULL, props.getScanner().getMode());
        assertEquals(5, props.getHook().getLargeFileMaxMb());
        assertEquals(Duration.ofSeconds(5), props.getPin().getResolveTimeout());
        assertTrue(policy.isExcluded("generated/Api.java"));
        assertFalse(policy.isExcluded("target/app.jar"));
    }

    @Test
    void startingWithoutACommandIsAUsageError() {
        assertEquals(ExitStatus.VALIDATION_ERROR, runner.status());
        assertEquals(ExitStatus.VALIDATION_ERROR.code(), runner.getExitCode());
    }
}
