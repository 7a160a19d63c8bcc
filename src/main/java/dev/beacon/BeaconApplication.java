package dev.beacon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Beacon retrieval service.
 *
 * <p>Runs as an MCP server over stdio; the answer-generation agent calls its tools to get
 * reranked knowledge-base context.
 */
@SpringBootApplication
public class BeaconApplication {
    public static void main(String[] args) {
        SpringApplication.run(BeaconApplication.class, args);
    }
}
