package com.example.signage.shared.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on @Scheduled processing (the display staleness sweep) everywhere
 * except the 'checkpoint-build' profile.
 */
@Configuration
@EnableScheduling
@Profile("!checkpoint-build")
public class SchedulingConditionalConfig {
}
