package eu.virtualparadox.docscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocScanApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocScanApplication.class, args);
    }
}
