package com.mk.fx.qa.load.contention.metrics;

import com.mk.fx.qa.load.contention.dto.controllerresponse.ContentionRunReport;

/** Contributes protocol-level detail to the final report. */
public interface ProtocolMetricsProvider {
  void applyTo(ContentionRunReport report);
}
