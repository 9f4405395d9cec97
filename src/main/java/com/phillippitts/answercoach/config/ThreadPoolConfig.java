package com.phillippitts.answercoach.config;

import com.phillippitts.answercoach.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind oracle calls and transcript pumps.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned in
 * application.properties based on hardware and workload.
 *
 * <p>MDC propagation: both pools copy the Log4j2 ThreadContext of the submitting thread
 * (requestId, sessionId) to the worker thread.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool for blocking oracle calls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected call fails fast and
     * is degraded by the oracle invoker; running it on the caller would escape the call deadline.
     *
     * @return executor for oracle calls
     */
    @Bean(name = "oracleExecutor")
    public Executor oracleExecutor() {
        return build(threadPoolProperties.getOracle(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Pool running one transcript pump per attached source. A zero queue capacity hands each pump
     * straight to a thread.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; attaching a source beyond
     * capacity fails instead of blocking the request thread.
     *
     * @return executor for transcript pumps
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        return build(threadPoolProperties.getSession(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker and restores the worker's own
     * context afterwards.
     */
    static TaskDecorator mdcPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
