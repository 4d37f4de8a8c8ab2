package eu.virtualparadox.docscan;

import eu.virtualparadox.docscan.application.executor.ScanWorkerPool;
import eu.virtualparadox.docscan.ingest.extractor.TextExtractor;
import eu.virtualparadox.docscan.scan.ScanOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "docscan.workers=3")
class DocScanApplicationTest {

    @Autowired
    private ScanOrchestrator scanOrchestrator;

    @Autowired
    private TextExtractor textExtractor;

    @Autowired
    private ScanWorkerPool scanWorkerPool;

    @Test
    void contextLoads() {
        assertThat(scanOrchestrator).isNotNull();
        assertThat(textExtractor).isNotNull();
        assertThat(scanWorkerPool.getWorkers()).isEqualTo(3);
    }
}
