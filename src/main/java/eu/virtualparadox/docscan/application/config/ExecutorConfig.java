package eu.virtualparadox.docscan.application.config;

import eu.virtualparadox.docscan.application.executor.ScanWorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean
    public ScanWorkerPool scanWorkerPool(final ApplicationConfig config) {
        final int workers = config.effectiveWorkers();
        log.info("Scan worker pool size: {}", workers);
        return new ScanWorkerPool(workers);
    }
}
