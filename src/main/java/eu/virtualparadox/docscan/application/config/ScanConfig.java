package eu.virtualparadox.docscan.application.config;

import eu.virtualparadox.docscan.scan.CandidateFileCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@Slf4j
public class ScanConfig {

    @Bean
    public CandidateFileCollector candidateFileCollector(final ApplicationConfig config) {
        final Path self = config.effectiveSelfPath();
        log.debug("Excluded from scanning: {}", self);
        return new CandidateFileCollector(self);
    }
}
