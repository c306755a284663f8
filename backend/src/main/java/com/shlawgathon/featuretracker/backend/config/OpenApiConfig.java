package com.shlawgathon.featuretracker.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    public static final String ADMIN_TOKEN_SCHEME = "adminToken";

    @Bean
    public OpenAPI featureTrackerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Feature Tracker API")
                        .description("Competitor changelog monitoring with incremental feature merge and tag taxonomy")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Feature Tracker Team")
                                .email("team@featuretracker.dev"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .components(new Components()
                        .addSecuritySchemes(ADMIN_TOKEN_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .description("Admin token configured as tracker.admin.token")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
