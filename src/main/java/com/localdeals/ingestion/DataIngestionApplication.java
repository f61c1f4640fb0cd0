package com.localdeals.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Main application class for LocalDeals Batch.
 * Runs the business ingestion job once and exits with the job's status.
 */
@SpringBootApplication
public class DataIngestionApplication {

    private static final Logger logger = LoggerFactory.getLogger(DataIngestionApplication.class);

    public static void main(String[] args) {
        logger.info("🚀 Starting LocalDeals Batch - business ingestion");

        ConfigurableApplicationContext context;
        try {
            context = SpringApplication.run(DataIngestionApplication.class, args);
        } catch (Exception e) {
            logger.error("❌ Failed to start LocalDeals Batch", e);
            System.exit(1);
            return;
        }

        int exitCode = SpringApplication.exit(context);
        logger.info("🏁 LocalDeals Batch finished with exit code {}", exitCode);
        System.exit(exitCode);
    }
}
