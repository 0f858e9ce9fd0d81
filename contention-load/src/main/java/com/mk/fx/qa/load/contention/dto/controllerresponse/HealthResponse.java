package com.mk.fx.qa.load.contention.dto.controllerresponse;

/** Health of the service: {@code UP} or {@code DOWN}. */
public record HealthResponse(String status) {}
