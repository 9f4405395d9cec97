package com.phillippitts.answercoach.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the oracle and session pools via Micrometer.
 *
 * <p>Gauges, each tagged {@code pool=oracle|session}:
 * <ul>
 *   <li>answercoach.pool.size - Current number of threads in the pool</li>
 *   <li>answercoach.pool.active - Number of actively executing tasks</li>
 *   <li>answercoach.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>answercoach.pool.completed - Cumulative count of completed tasks</li>
 *   <li>answercoach.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>A saturated session pool means {@code attachSource} calls are being rejected; a saturated
 * oracle pool shows up as degraded oracle calls.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<Executor> oracleExecutorProvider;
    private final ObjectProvider<Executor> sessionExecutorProvider;

    public ThreadPoolMetricsConfig(@Qualifier("oracleExecutor") ObjectProvider<Executor> oracleExecutorProvider,
                                   @Qualifier("sessionExecutor") ObjectProvider<Executor> sessionExecutorProvider) {
        this.oracleExecutorProvider = oracleExecutorProvider;
        this.sessionExecutorProvider = sessionExecutorProvider;
    }

    @Bean
    public MeterBinder threadPoolMetrics() {
        return registry -> {
            bind(registry, "oracle", oracleExecutorProvider.getIfAvailable());
            bind(registry, "session", sessionExecutorProvider.getIfAvailable());
        };
    }

    static void bind(MeterRegistry registry, String pool, Executor candidate) {
        if (!(candidate instanceof ThreadPoolTaskExecutor taskExecutor)) {
            LOG.debug("Pool '{}' is not a ThreadPoolTaskExecutor; no pool metrics", pool);
            return;
        }
        ThreadPoolExecutor executor = taskExecutor.getThreadPoolExecutor();

        Gauge.builder("answercoach.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("answercoach.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("answercoach.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("answercoach.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("answercoach.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size")
                .tag("pool", pool)
                .register(registry);

        LOG.info("Thread pool metrics registered for pool '{}'", pool);
    }
}
