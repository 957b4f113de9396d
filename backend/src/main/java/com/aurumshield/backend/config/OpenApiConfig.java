package com.aurumshield.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI capitalOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("AurumShield Capital Risk API")
                        .description("Capital adequacy snapshots, breach history, control modes, overrides and transaction policy")
                        .version("1.0"))
                .addTagsItem(new Tag().name("capital").description("Snapshots, breaches and intraday export"))
                .addTagsItem(new Tag().name("capital-controls").description("Control modes, overrides and action gate"))
                .addTagsItem(new Tag().name("policy").description("Transaction risk index and approval routing"));
    }
}
