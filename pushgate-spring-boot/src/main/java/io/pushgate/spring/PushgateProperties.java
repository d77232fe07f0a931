/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring;

import io.pushgate.core.api.model.ScanMode;
import io.pushgate.core.api.model.SecretCategory;
import io.pushgate.core.install.InstallOptions;
import io.pushgate.core.preset.ScanPolicy;
import java.time.Duration;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "pushgate")
public class PushgateProperties {

    /** Repository the commands work on. */
    @Setter
    private String root = ".";

    @Setter
    private boolean verbose = false;

    private Scanner scanner = new Scanner();
    private Pin pin = new Pin();
    private Hook hook = new Hook();
    private Install install = new Install();

    public void setScanner(Scanner scanner) {
        this.scanner = (scanner == null) ? new Scanner() : scanner;
    }

    public void setPin(Pin pin) {
        this.pin = (pin == null) ? new Pin() : pin;
    }

    public void setHook(Hook hook) {
        this.hook = (hook == null) ? new Hook() : hook;
    }

    public void setInstall(Install install) {
        this.install = (install == null) ? new Install() : install;
    }

    // ---- nested: scanner ----
    public static final class Scanner {
        @Setter
        @Getter
        private ScanMode mode = ScanMode.STAGED;

        @Setter
        @Getter
        private boolean redact = true;

        @Setter
        @Getter
        private String allowlistFile = InstallOptions.DEFAULT_STATE_DIR + "/secret-allowlist.txt";

        @Setter
        @Getter
        private int minSecretLength = ScanPolicy.DEFAULT_MIN_SECRET_LENGTH;

        @Setter
        @Getter
        private double minEntropy = ScanPolicy.DEFAULT_MIN_ENTROPY;

        private List<String> excludedPaths = new ArrayList<>(ScanPolicy.DEFAULT_EXCLUDED_PATHS);
        private List<String> lockFiles = new ArrayList<>(ScanPolicy.DEFAULT_LOCK_FILES);
        private List<SecretCategory> categories = new ArrayList<>(); // empty = all

        public List<String> getExcludedPaths() {
            return Collections.unmodifiableList(excludedPaths);
        }

        public void setExcludedPaths(List<String> v) {
            this.excludedPaths = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getLockFiles() {
            return Collections.unmodifiableList(lockFiles);
        }

        public void setLockFiles(List<String> v) {
            this.lockFiles = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<SecretCategory> getCategories() {
            return Collections.unmodifiableList(categories);
        }

        public void setCategories(List<SecretCategory> v) {
            this.categories = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }
    }

    // ---- nested: pin ----
    @Getter
    @Setter
    public static final class Pin {
        private String workflowsDir = ".github/workflows";
        private boolean autopinOnFailure = true;
        private Duration resolveTimeout = Duration.ofSeconds(30);
        private String githubUrl = "https://github.com";
    }

    // ---- nested: hook ----
    @Getter
    @Setter
    public static final class Hook {
        private boolean secretScan = true;
        private boolean pinCheck = true;
        private boolean largeFileCheck = true;
        private long largeFileMaxMb = 10;
    }

    // ---- nested: install ----
    @Getter
    @Setter
    public static final class Install {
        private String stateDir = InstallOptions.DEFAULT_STATE_DIR;
        private boolean hooksPath = false;
        private String hooksPathDir = InstallOptions.DEFAULT_HOOKS_PATH_DIR;
    }
}
