package com.baykanat.ephemeral.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/** Silme zamanlayıcıları, uzlaştırma thread havuzu ve zaman kaynağı bean'leri. */
@Configuration
@RequiredArgsConstructor
public class DeletionSchedulerConfig {

    private final AppProperties appProperties;

    /** fire_at ve kalan süre hesapları için UTC saat. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Mesaj başına bir gecikmeli silme görevi; @Scheduled işleri de bu havuzda çalışır. */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler deletionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(appProperties.getScheduler().getDeletionPoolSize());
        scheduler.setThreadNamePrefix("ephemeral-delete-");
        // İptal edilen görevler kuyrukta TTL boyunca beklemesin
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /** Kanal başına bir uzlaştırma görevi; Kafka consumer thread'ini bloklamaz. */
    @Bean
    public ThreadPoolTaskExecutor reconciliationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int poolSize = appProperties.getScheduler().getReconciliationPoolSize();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("ephemeral-reconcile-");
        return executor;
    }
}
