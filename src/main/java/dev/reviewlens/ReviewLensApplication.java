package dev.reviewlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the ReviewLens question-answering service.
 *
 * <p>Runs as an MCP server over stdio; see {@code application.yml} for the transport settings.
 */
@SpringBootApplication
@EnableRetry
public class ReviewLensApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReviewLensApplication.class, args);
    }
}
