package com.portray.portal.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the session purge and terminal event relay jobs.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
