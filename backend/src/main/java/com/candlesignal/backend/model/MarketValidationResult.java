package com.candlesignal.backend.model;

import java.time.LocalDate;

/**
 * Outcome of market-hours validation for one instrument in one pass.
 *
 * @param series        candles detectors may use; the forming candle is already removed
 * @param signalDate    nominal date attributed to signals of this pass
 * @param justification human readable explanation, names the candle actually used
 * @param lowConfidence set when a possibly forming candle had to be kept
 */
public record MarketValidationResult(
        PriceSeries series,
        LocalDate signalDate,
        String justification,
        MarketState marketState,
        boolean lowConfidence
) {
    public boolean hasData() {
        return series != null && !series.isEmpty();
    }
}
