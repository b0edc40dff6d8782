package com.starscape.rapidvariant.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the run registry eviction and the outbox relay.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
