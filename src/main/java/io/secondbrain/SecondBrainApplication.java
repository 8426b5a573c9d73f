package io.secondbrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Second Brain: a memory knowledge-graph engine powered by Spring AI and JobRunr.
 * Ingests text into embedded memories, links them with typed relationships and serves time-decayed search.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SecondBrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecondBrainApplication.class, args);
    }
}
