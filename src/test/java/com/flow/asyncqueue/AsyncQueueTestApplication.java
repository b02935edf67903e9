package com.flow.asyncqueue;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Boot application used by the integration tests to pick up the auto-configuration.
 */
@SpringBootApplication
public class AsyncQueueTestApplication {
}
