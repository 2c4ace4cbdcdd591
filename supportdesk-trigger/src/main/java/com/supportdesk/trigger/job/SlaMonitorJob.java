package com.supportdesk.trigger.job;

import com.supportdesk.trigger.application.command.SlaBreachApplicationService;
import com.supportdesk.trigger.application.command.SlaBreachApplicationService.SweepResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SLA 监控守护任务：周期扫描首次响应超时的 OPEN 工单并驱动违约处理。
 * 固定延迟调度，上一轮未结束时新一轮直接跳过并记录。
 */
@Slf4j
@Component
public class SlaMonitorJob {

    private final SlaBreachApplicationService slaBreachApplicationService;
    private final Clock clock;
    private final int batchSize;
    private final boolean enabled;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Counter sweepCounter;
    private final Counter skippedCounter;
    private final Counter failureCounter;

    public SlaMonitorJob(SlaBreachApplicationService slaBreachApplicationService,
                         Clock clock,
                         @Value("${sla-monitor.batch-size:200}") int batchSize,
                         @Value("${sla-monitor.enabled:true}") boolean enabled) {
        this.slaBreachApplicationService = slaBreachApplicationService;
        this.clock = clock;
        this.batchSize = batchSize > 0 ? batchSize : 200;
        this.enabled = enabled;
        this.sweepCounter = Counter.builder("supportdesk.sla.sweep.total").register(Metrics.globalRegistry);
        this.skippedCounter = Counter.builder("supportdesk.sla.sweep.skipped.total").register(Metrics.globalRegistry);
        this.failureCounter = Counter.builder("supportdesk.sla.sweep.failure.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${sla-monitor.poll-interval-ms:300000}",
            initialDelayString = "${sla-monitor.initial-delay-ms:60000}",
            scheduler = "slaMonitorScheduler")
    public void sweepBreaches() {
        if (!enabled) {
            return;
        }
        runOnce();
    }

    /**
     * 执行一轮扫描，返回 null 表示因上一轮仍在运行而跳过。
     */
    public SweepResult runOnce() {
        if (!running.compareAndSet(false, true)) {
            skippedCounter.increment();
            log.warn("SLA sweep skipped, previous sweep still running");
            return null;
        }
        try {
            sweepCounter.increment();
            return slaBreachApplicationService.sweep(LocalDateTime.now(clock), batchSize);
        } catch (RuntimeException ex) {
            failureCounter.increment();
            log.error("SLA sweep failed. error={}", ex.getMessage(), ex);
            return SweepResult.empty();
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
