package com.ozone.dispatch.api;

/**
 * Optional JSON body for pause, resume and cancel.
 *
 * @param reason free-text reason recorded in the interruption log; nullable
 */
public record InterruptRequest(String reason) {}
