package com.superintendent.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.superintendent.orchestrator.backend.DryRunBackend;
import com.superintendent.orchestrator.backend.ExecutionBackend;
import com.superintendent.orchestrator.backend.RemoteBackend;
import com.superintendent.orchestrator.backend.SandboxClient;
import com.superintendent.orchestrator.service.FailurePolicy;
import com.superintendent.orchestrator.service.OrchestratorSettings;
import com.superintendent.orchestrator.state.CheckpointStore;
import com.superintendent.orchestrator.strategy.ExecutionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the orchestration components from {@code superintendent.*} properties.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public OrchestratorSettings orchestratorSettings(
            @Value("${superintendent.orchestrator.max-parallel:3}") int maxParallel,
            @Value("${superintendent.orchestrator.poll-interval:5s}") Duration pollInterval,
            @Value("${superintendent.orchestrator.failure-policy:skip}") String failurePolicy,
            @Value("${superintendent.orchestrator.max-retries:1}") int maxRetries) {
        return new OrchestratorSettings(maxParallel, pollInterval,
                FailurePolicy.fromValue(failurePolicy), maxRetries);
    }

    @Bean
    public ExecutionStrategy executionStrategy(
            @Value("${superintendent.strategy.max-parallel-agents:8}") int maxParallelAgents) {
        return new ExecutionStrategy(maxParallelAgents);
    }

    /**
     * "dry-run" (default) touches nothing; "remote" forwards steps to the
     * sandbox executor service at {@code superintendent.backend.base-url}.
     */
    @Bean
    public ExecutionBackend executionBackend(
            @Value("${superintendent.backend.mode:dry-run}") String mode,
            @Value("${superintendent.backend.base-url:http://localhost:8000}") String baseUrl,
            ObjectMapper objectMapper) {
        return switch (mode.trim().toLowerCase(Locale.ROOT)) {
            case "dry-run" -> new DryRunBackend();
            case "remote"  -> {
                log.info("Using remote sandbox executor at {}", baseUrl);
                yield new RemoteBackend(new SandboxClient(baseUrl, objectMapper));
            }
            default -> throw new IllegalStateException(
                    "Unknown superintendent.backend.mode '" + mode + "' (expected dry-run or remote)");
        };
    }

    @Bean
    @ConditionalOnProperty(name = "superintendent.checkpoint.dir")
    public CheckpointStore checkpointStore(@Value("${superintendent.checkpoint.dir}") String dir,
                                           ObjectMapper objectMapper) {
        return new CheckpointStore(Path.of(dir), objectMapper);
    }

    // Each worker drives one orchestration loop at a time.
    @Bean(destroyMethod = "shutdown")
    public ExecutorService runExecutor(@Value("${superintendent.runs.workers:2}") int workers) {
        return Executors.newFixedThreadPool(workers);
    }
}
