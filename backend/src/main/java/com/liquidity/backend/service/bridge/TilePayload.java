package com.liquidity.backend.service.bridge;

import com.liquidity.backend.model.Signal;

/**
 * Dashboard tile view of a report.
 *
 * @param status one of {@code positive}, {@code normal}, {@code warning}, {@code critical}
 */
public record TilePayload(String title, String primaryMetric, String status, String action, Signal signal,
                          double confidence) {}
