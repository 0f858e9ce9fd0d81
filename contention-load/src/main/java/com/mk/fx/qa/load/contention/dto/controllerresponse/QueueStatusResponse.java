package com.mk.fx.qa.load.contention.dto.controllerresponse;

/** Tasks waiting, tasks running, and whether new submissions are accepted. */
public record QueueStatusResponse(int queueSize, int activeTasks, boolean acceptingTasks) {}
