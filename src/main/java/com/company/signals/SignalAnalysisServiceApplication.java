package com.company.signals;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableAsync
@OpenAPIDefinition(
        info = @Info(
                title = "Signal Analysis Service API",
                version = "1.0.0",
                description = "Error-tracking triage and metering outbox health analysis"
        )
)
public class SignalAnalysisServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalAnalysisServiceApplication.class, args);
    }
}
