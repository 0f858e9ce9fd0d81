package com.mk.fx.qa.load.contention.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "load.tasks")
public class TaskProcessingCfg {

  /** Runs executed in parallel. Each run has its own worker pool. */
  @Min(1)
  @Max(16)
  private int concurrency = 1;

  @Positive private int historySize = 50;
}
