package com.mk.fx.qa.load.contention.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Contention Load Runner API")
                .description(
                    "Submits optimistic-concurrency load runs against a versioned resource API."));
  }
}
