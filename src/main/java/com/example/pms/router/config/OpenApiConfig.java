package com.example.pms.router.config;

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
        title = "PMS Query Router API",
        version = "v1",
        description = "Query routing, related records and embedding refresh."
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
            .title("PMS Query Router API")
            .version("v1")
            .description("Swagger UI for the routing, relation and refresh endpoints."));
  }

  @Bean
  public GroupedOpenApi routerApi() {
    return GroupedOpenApi.builder()
        .group("router")
        .packagesToScan("com.example.pms.router.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
