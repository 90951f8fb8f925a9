package com.candlesignal.backend.signal.pipeline;

import com.candlesignal.backend.model.Instrument;
import com.candlesignal.backend.model.PriceSeries;

/**
 * Source of daily candles for an instrument.
 */
public interface CandleSeriesProvider {

    /**
     * @param lookback number of recent candles (crypto) or calendar days (stocks) wanted
     */
    PriceSeries fetchSeries(Instrument instrument, int lookback);
}
