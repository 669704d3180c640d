package com.example.flowcompiler.config;

import com.example.flowcompiler.compiler.WorkflowCompiler;
import com.example.flowcompiler.compiler.WorkflowDecompiler;
import com.example.flowcompiler.session.EditingSessionService;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

@Configuration
public class CompilerConfiguration {

    @Bean
    public WorkflowCompiler workflowCompiler() {
        return new WorkflowCompiler();
    }

    @Bean
    public WorkflowDecompiler workflowDecompiler() {
        return new WorkflowDecompiler();
    }

    /** Single thread: debounced compiles of one session never overlap. */
    @Bean
    public ThreadPoolTaskScheduler compileScheduler(
            @Value("${flow-compiler.scheduler.thread-name-prefix:flow-compile-}") String threadNamePrefix) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public EditingSessionService editingSessionService(
            WorkflowCompiler compiler,
            WorkflowDecompiler decompiler,
            TaskScheduler compileScheduler,
            @Value("${flow-compiler.session.debounce:100ms}") Duration debounce,
            @Value("${flow-compiler.session.idle-timeout:30m}") Duration idleTimeout,
            @Value("${flow-compiler.session.idle-sweep-interval:1m}") Duration sweepInterval) {
        return new EditingSessionService(compiler, decompiler, compileScheduler, debounce, idleTimeout, sweepInterval);
    }
}
