package eu.virtualparadox.docscan.application.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationConfigTest {

    @Test
    void effectiveWorkers_defaultsToProcessorCount() {
        final ApplicationConfig config = new ApplicationConfig();

        assertThat(config.effectiveWorkers()).isEqualTo(Runtime.getRuntime().availableProcessors());

        config.setWorkers(4);
        assertThat(config.effectiveWorkers()).isEqualTo(4);
    }

    @Test
    void effectiveSelfPath_prefersConfiguredPath() {
        final ApplicationConfig config = new ApplicationConfig();
        config.setSelfPath(Path.of("tools", "..", "docscan.jar"));

        assertThat(config.effectiveSelfPath()).isEqualTo(Path.of("docscan.jar").toAbsolutePath());
    }
}
