package com.supportdesk.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * SLA 巡检调度器。
 * <p>
 * 巡检本身串行（{@code SlaMonitorJob} 内有重入保护），单线程即可；
 * 停机时等待当前一轮巡检结束，避免工单停在半提交状态。
 * </p>
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    static final String SLA_MONITOR_THREAD_PREFIX = "sla-monitor-";

    @Bean(name = "slaMonitorScheduler")
    public ThreadPoolTaskScheduler slaMonitorScheduler(
            @Value("${scheduling.sla-monitor.pool-size:1}") int poolSize,
            @Value("${scheduling.sla-monitor.await-termination-seconds:30}") int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler slaScheduler = new ThreadPoolTaskScheduler();
        slaScheduler.setPoolSize(poolSize < 1 ? 1 : poolSize);
        slaScheduler.setThreadNamePrefix(SLA_MONITOR_THREAD_PREFIX);
        slaScheduler.setDaemon(true);
        slaScheduler.setWaitForTasksToCompleteOnShutdown(true);
        slaScheduler.setAwaitTerminationSeconds(Math.max(0, awaitTerminationSeconds));
        slaScheduler.setErrorHandler(ex ->
                log.error("SLA monitor tick failed outside sweep guard. errorType={}, error={}",
                        ex.getClass().getSimpleName(), ex.getMessage(), ex));
        log.info("SLA monitor scheduler ready. poolSize={}, awaitTerminationSeconds={}",
                slaScheduler.getPoolSize(), awaitTerminationSeconds);
        return slaScheduler;
    }
}
