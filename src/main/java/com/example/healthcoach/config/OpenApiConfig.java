package com.example.healthcoach.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "BP Health Coach API",
        version = "v1",
        description = "Questions about blood pressure data, what-if scenarios and coaching jobs."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("BP Health Coach API")
            .version("v1")
            .description("Swagger UI for the coaching pipeline and job endpoints."));
  }

  @Bean
  public GroupedOpenApi coachApi() {
    return GroupedOpenApi.builder()
        .group("coach")
        .packagesToScan("com.example.healthcoach.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
