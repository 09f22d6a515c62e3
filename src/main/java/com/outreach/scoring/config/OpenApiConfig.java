package com.outreach.scoring.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI leadScoringOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Lead Scoring API")
                        .version("1.0.0")
                        .description(
                                "Rule-driven scoring of contact records for outreach prioritization.\n\n" +
                                "**Scoring Pipeline:**\n" +
                                "1. Validate a rule configuration (`POST /configurations/validate`) or start from a template\n" +
                                "2. Extract features per record: domain class, structure, geography, keyword relevance\n" +
                                "3. Classify anomalies: statistical outliers, pattern signatures, neighbor density\n" +
                                "4. Combine the four dimensions with renormalized weights (0-100)\n" +
                                "5. Apply multiplicative bonuses and penalties, clamped at the configured floor\n" +
                                "6. Assign a tier: **HIGH**, **MEDIUM**, **LOW** or **EXCLUDED** (CRITICAL anomalies are always EXCLUDED)\n\n" +
                                "**Bulk list updates:** `POST /lists/bulk-update` patches country, category, priority, " +
                                "processed, description or display_name on many stored lists; the store is rewritten atomically.")
                        .contact(new Contact().name("Lead Scoring Team")));
    }
}
