package com.liquidity.backend.service.marketdata;

import com.liquidity.backend.model.IndicatorSample;

/**
 * Adapter for one external market data API. Failures are reported as
 * {@link com.liquidity.backend.exception.IndicatorFetchException} so the retry handler can classify them.
 */
public interface IndicatorSource {

    /**
     * API name as used in the rate limit table and the feed routes.
     */
    String name();

    IndicatorSample fetchLatest(String indicator);
}
