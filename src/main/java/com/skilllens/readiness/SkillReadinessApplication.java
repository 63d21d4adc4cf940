package com.skilllens.readiness;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SkillReadinessApplication {
    public static void main(String[] args) {
        SpringApplication.run(SkillReadinessApplication.class, args);
    }
}
