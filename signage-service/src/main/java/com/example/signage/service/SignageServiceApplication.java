package com.example.signage.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Content scheduling engine and live delivery hub for signage displays.
 * <p>
 * Admins assign time-windowed, prioritized and optionally recurring content to
 * displays or display groups. The service resolves the authoritative content per
 * display on demand, turns schedules into timed jobs, and pushes the resulting
 * changes to connected displays over Server-Sent Events. It also tracks display
 * heartbeats, uptime and errors.
 */
@SpringBootApplication(scanBasePackages = "com.example.signage")
public class SignageServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignageServiceApplication.class, args);
    }
}
