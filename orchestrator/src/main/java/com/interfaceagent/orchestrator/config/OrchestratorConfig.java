package com.interfaceagent.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for pipeline execution.
 *
 * executionExecutor runs one task per execution and caps how many executions
 * are in flight. stepExecutor runs the agent calls themselves so a step can be
 * abandoned on timeout while its execution thread moves on.
 */
@Configuration
public class OrchestratorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService executionExecutor(@Value("${interface-agent.execution.workers:8}") int workers) {
        return Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("execution-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stepExecutor() {
        CustomizableThreadFactory threads = new CustomizableThreadFactory("agent-step-");
        threads.setDaemon(true);
        return Executors.newCachedThreadPool(threads);
    }
}
