package eu.virtualparadox.docscan.application.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.net.URISyntaxException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.security.CodeSource;

@Configuration
@ConfigurationProperties(prefix = "docscan")
@Getter @Setter
@Slf4j
public class ApplicationConfig {

    /**
     * Number of scan workers; {@code 0} or less means one per available processor.
     */
    private int workers;

    /**
     * Path of the running program, never scheduled for scanning.
     * Resolved from the code source when not configured.
     */
    private Path selfPath;

    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    public Path effectiveSelfPath() {
        if (selfPath != null) {
            return selfPath.toAbsolutePath().normalize();
        }
        try {
            final CodeSource codeSource = ApplicationConfig.class.getProtectionDomain().getCodeSource();
            if (codeSource == null || codeSource.getLocation() == null) {
                return null;
            }
            return Path.of(codeSource.getLocation().toURI()).toAbsolutePath().normalize();
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            log.debug("Unable to resolve own code location", e);
            return null;
        }
    }
}
