package com.ozone.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param objective task objective handed to the planner
 */
public record TaskRequest(String objective) {}
