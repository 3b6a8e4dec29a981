package com.pharma.signal.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI signalMonitorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Adverse-Event Signal Monitor API")
                        .version("1.0.0")
                        .description(
                                "Quarterly adverse-event report monitoring for pharmacovigilance.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit quarterly report counts via `POST /monitoring/{drug}/run`\n" +
                                "2. Normalize to a gap-handled quarterly series (zero, carry-forward or drop)\n" +
                                "3. Forecast the next quarters with confidence bounds\n" +
                                "4. Score each quarter against a rolling baseline (z-score)\n" +
                                "5. Classify each quarter: **NONE**, **WATCH** or **ALERT**\n" +
                                "6. Summarize the run and cache the report per drug variant\n\n" +
                                "**Signal Rules (in precedence order):**\n" +
                                "- `QOQ_SURGE_WITH_ANOMALY` (ALERT): anomaly plus relative and absolute increase\n" +
                                "- `QOQ_SURGE` (WATCH): relative and absolute increase without an anomaly\n" +
                                "- `STATISTICAL_ANOMALY` (WATCH): |z| above the anomaly threshold\n\n" +
                                "**Forecast Models:** `piecewise-seasonal` (default), `holt-linear`")
                        .contact(new Contact().name("Pharmacovigilance Analytics Team")));
    }
}
