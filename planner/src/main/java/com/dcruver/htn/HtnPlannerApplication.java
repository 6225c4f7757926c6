package com.dcruver.htn;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Interactive shell around the HTN planner.
 *
 * The planner itself is a plain library: {@link com.dcruver.htn.domain.planning.HtnPlanner}
 * needs no Spring context and can be constructed directly.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class HtnPlannerApplication {

    public static void main(String[] args) {
        log.info("Starting HTN planner shell...");
        SpringApplication.run(HtnPlannerApplication.class, args);
    }
}
