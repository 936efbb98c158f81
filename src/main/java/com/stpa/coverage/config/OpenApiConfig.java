package com.stpa.coverage.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI coverageEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("STPA Combination & Coverage API")
                        .version("1.0.0")
                        .description(
                                "Enumerates, scores and ranks unsafe control-action combinations and drives " +
                                "guided, resumable coverage of every (controller, action, analysis type) cell.\n\n" +
                                "**Ranking Pipeline:**\n" +
                                "1. Post a snapshot to `POST /combinations/rank`\n" +
                                "2. Order controllers bottom-up, left-to-right (cycles are rejected with 409)\n" +
                                "3. Enumerate action subsets of size 2..maxCombinationSize spanning >= 2 controllers\n" +
                                "4. Score each candidate with the versioned additive rule set (0-100)\n" +
                                "5. Sort by score, ties broken by canonical signature\n\n" +
                                "**Scoring Rules:**\n" +
                                "- `CONTROLLER_COUNT`: per controller beyond the first\n" +
                                "- `TYPE_DIVERSITY`: per controller type beyond the first\n" +
                                "- `TEAM_PRESENCE` / `ORGANIZATION_PRESENCE`: team or organization involved\n" +
                                "- `FLAGGED_ACTION`: per action that already has a finding\n" +
                                "- `MULTI_ROLE_TEAM`: per team declaring several roles\n\n" +
                                "**Review Sessions:** `POST /sessions` opens a guided traversal; advance, retreat, " +
                                "complete or skip cells and read the completion ratio.")
                        .contact(new Contact().name("Safety Analysis Tooling")));
    }
}
