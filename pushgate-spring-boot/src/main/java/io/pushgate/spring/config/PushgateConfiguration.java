/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pushgate.core.api.model.ScanMode;
import io.pushgate.core.api.model.SecretCategory;
import io.pushgate.core.install.GateInstaller;
import io.pushgate.core.install.GateUninstaller;
import io.pushgate.core.pin.AutopinRewriter;
import io.pushgate.core.pin.DockerImageDigestResolver;
import io.pushgate.core.pin.GitLsRemoteShaResolver;
import io.pushgate.core.pin.ImageDigestResolver;
import io.pushgate.core.pin.PinValidator;
import io.pushgate.core.pin.ReferenceExtractor;
import io.pushgate.core.pin.ShaResolver;
import io.pushgate.core.preset.PatternCatalog;
import io.pushgate.core.preset.ScanPolicy;
import io.pushgate.core.source.CommandRunner;
import io.pushgate.core.source.ContentSource;
import io.pushgate.core.source.GitChangeSetProvider;
import io.pushgate.core.source.GitTrackedFiles;
import io.pushgate.core.source.ProcessCommandRunner;
import io.pushgate.core.source.StagedSource;
import io.pushgate.core.source.TrackedFilesSource;
import io.pushgate.core.txn.TransactionManager;
import io.pushgate.spring.MicrometerReporter;
import io.pushgate.spring.PushgateProperties;
import io.pushgate.spring.cli.GateCommands;
import io.pushgate.spring.cli.PushgateCommandRunner;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.function.Function;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(PushgateProperties.class)
public class PushgateConfiguration {

    @Bean
    public Path repositoryRoot(PushgateProperties props) {
        return Path.of(props.getRoot()).toAbsolutePath().normalize();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MicrometerReporter micrometerReporter(MeterRegistry registry) {
        return new MicrometerReporter(registry);
    }

    @Bean
    @ConditionalOnMissingBean(CommandRunner.class)
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    public TransactionManager transactionManager() {
        return new TransactionManager();
    }

    @Bean
    public ScanPolicy scanPolicy(PushgateProperties props) {
        PushgateProperties.Scanner s = props.getScanner();
        return new ScanPolicy(s.getExcludedPaths(), s.getLockFiles(), s.getMinSecretLength(), s.getMinEntropy());
    }

    @Bean
    public PatternCatalog patternCatalog(PushgateProperties props, ScanPolicy policy) {
        var categories = props.getScanner().getCategories().isEmpty()
                ? PatternCatalog.defaultCategories()
                : EnumSet.copyOf(props.getScanner().getCategories());
        return PatternCatalog.build(categories, policy);
    }

    @Bean
    public Function<ScanMode, ContentSource> contentSources(Path repositoryRoot, CommandRunner runner, ScanPolicy policy) {
        return mode -> switch (mode) {
            case STAGED -> new StagedSource(new GitChangeSetProvider(repositoryRoot, runner), policy);
            case FULL -> new TrackedFilesSource(repositoryRoot, new GitTrackedFiles(repositoryRoot, runner), policy);
        };
    }

    @Bean
    public ReferenceExtractor referenceExtractor() {
        return new ReferenceExtractor();
    }

    @Bean
    public PinValidator pinValidator(ReferenceExtractor extractor) {
        return new PinValidator(extractor);
    }

    @Bean
    @ConditionalOnMissingBean(ShaResolver.class)
    public ShaResolver shaResolver(PushgateProperties props, Path repositoryRoot, CommandRunner runner) {
        return new GitLsRemoteShaResolver(
                runner, repositoryRoot, props.getPin().getGithubUrl(), resolveTimeout(props));
    }

    @Bean
    @ConditionalOnMissingBean(ImageDigestResolver.class)
    public ImageDigestResolver imageDigestResolver(PushgateProperties props, Path repositoryRoot, CommandRunner runner) {
        return new DockerImageDigestResolver(runner, repositoryRoot, resolveTimeout(props));
    }

    @Bean
    public AutopinRewriter autopinRewriter(
            ReferenceExtractor extractor,
            ShaResolver shaResolver,
            ImageDigestResolver digestResolver,
            TransactionManager transactions) {
        return new AutopinRewriter(extractor, shaResolver, digestResolver, transactions);
    }

    @Bean
    public GateInstaller gateInstaller(TransactionManager transactions, CommandRunner runner) {
        return new GateInstaller(transactions, runner);
    }

    @Bean
    public GateUninstaller gateUninstaller(TransactionManager transactions) {
        return new GateUninstaller(transactions);
    }

    @Bean
    public GateCommands gateCommands(
            PushgateProperties props,
            Path repositoryRoot,
            PatternCatalog catalog,
            ScanPolicy policy,
            Function<ScanMode, ContentSource> contentSources,
            MicrometerReporter micrometerReporter,
            PinValidator validator,
            AutopinRewriter autopin,
            GateInstaller installer,
            GateUninstaller uninstaller) {
        return new GateCommands(
                props,
                repositoryRoot,
                catalog,
                policy,
                contentSources,
                micrometerReporter,
                validator,
                autopin,
                installer,
                uninstaller,
                System.out);
    }

    @Bean
    public PushgateCommandRunner pushgateCommandRunner(GateCommands commands, PushgateProperties props) {
        return new PushgateCommandRunner(commands, props, System.err);
    }

    private static Duration resolveTimeout(PushgateProperties props) {
        Duration t = props.getPin().getResolveTimeout();
        return (t == null || t.isNegative() || t.isZero()) ? Duration.ofSeconds(30) : t;
    }
}
