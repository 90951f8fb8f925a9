package com.candlesignal.backend.signal.pipeline;

import com.candlesignal.backend.model.Instrument;
import com.candlesignal.backend.model.PriceSeries;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Replays preloaded series, keyed by {@link Instrument#dataSymbol()}.
 */
@Slf4j
public class InMemoryCandleSeriesProvider implements CandleSeriesProvider {

    private final Map<String, PriceSeries> seriesBySymbol = new ConcurrentHashMap<>();

    public void put(String dataSymbol, PriceSeries series) {
        seriesBySymbol.put(dataSymbol.toUpperCase(Locale.ROOT), series);
    }

    @Override
    public PriceSeries fetchSeries(Instrument instrument, int lookback) {
        PriceSeries series = seriesBySymbol.get(instrument.dataSymbol());
        if (series == null) {
            log.debug("No candles loaded for {}", instrument.dataSymbol());
            return PriceSeries.empty();
        }
        return series.tail(lookback);
    }
}
