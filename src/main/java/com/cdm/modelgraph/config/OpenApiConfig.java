package com.cdm.modelgraph.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI modelGraphOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8000");
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("CDM Model Graph Admin API")
                .version("1.0.0")
                .description("Admin endpoints for reconciling driver relationships, default object " +
                        "relationships, tiered list chains and Group-Part exclusivity in the CDM graph.");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
