package com.funnelforge.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/arms/{id}/outcome.
 *
 * @param revenue     revenue delta
 * @param spend       spend delta
 * @param clicks      clicks delta; nullable, defaults to 1
 * @param conversions conversions delta; nullable, defaults to 0
 */
public record OutcomeRequest(
    double revenue,
    double spend,
    Long clicks,
    Long conversions
) {}
