package com.whereq.governor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Governor.
 * This service keeps concurrent workloads inside a CPU, memory and accelerator budget,
 * delays jobs that do not fit and trims cached assets under memory pressure.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class GovernorApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernorApplication.class, args);
    }
}
