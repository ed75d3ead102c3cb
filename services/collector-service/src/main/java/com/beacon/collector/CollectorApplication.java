package com.beacon.collector;

import com.beacon.collector.config.CollectorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Beacon Collector: an HTTP front door over the untyped entry points of the Beacon client.
 *
 * <p>WHY a service: callers that cannot link the Java client (web pages, shell scripts, other
 * runtimes) post JSON bodies here and get the same normalization, identity handling and
 * enrichment as in-process callers.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health and metrics endpoints, including the {@code beacon.*} dispatch counters
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(CollectorProperties.class)
public class CollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectorApplication.class, args);
    }
}
