package com.changefeed.gateway.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * REST documentation only. The change stream itself is a WebSocket at {@code /v1/stream} and is
 * described by the JSON schemas under {@code contracts/wire-schemas}.
 */
@Configuration
public class OpenApiConfig {
  private static final String BEARER_SCHEME = "bearer-jwt";

  @Bean
  public OpenAPI gatewayOpenApi(
      ObjectProvider<BuildProperties> buildProperties,
      @Value("${spring.application.name:realtime-gateway}") String applicationName) {
    String version =
        buildProperties.stream()
            .map(BuildProperties::getVersion)
            .filter(value -> value != null && !value.isBlank())
            .findFirst()
            .orElse("dev");
    return new OpenAPI()
        .info(
            new Info()
                .title(applicationName)
                .version(version)
                .description(
                    "Baseline snapshots and engine status. Subscribe to changes over the WebSocket"
                        + " at /v1/stream, resuming from a snapshot's atSequence."))
        .components(
            new Components()
                .addSecuritySchemes(
                    BEARER_SCHEME,
                    new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")))
        .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
  }

  @Bean
  public GroupedOpenApi snapshotsApiGroup() {
    return GroupedOpenApi.builder().group("snapshots").pathsToMatch("/v1/snapshots/**").build();
  }

  @Bean
  public GroupedOpenApi engineApiGroup() {
    return GroupedOpenApi.builder()
        .group("engine")
        .pathsToMatch("/v1/engine/**", "/actuator/health/**", "/actuator/prometheus")
        .build();
  }
}
