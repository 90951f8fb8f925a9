package com.candlesignal.backend.signal.pipeline;

import com.candlesignal.backend.model.Instrument;
import com.candlesignal.backend.model.PriceSeries;
import com.candlesignal.backend.util.TestSeriesFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCandleSeriesProviderTest {

    private final InMemoryCandleSeriesProvider provider = new InMemoryCandleSeriesProvider();

    @Test
    void looksUpByDataSymbolAndReturnsTail() {
        PriceSeries series = TestSeriesFactory.startingAt(10).steps(99, 0.1).build();
        provider.put("BHP.AX", series);

        PriceSeries fetched = provider.fetchSeries(Instrument.stock(1L, "bhp", "ASX"), 60);

        assertThat(fetched.size()).isEqualTo(60);
        assertThat(fetched.lastDate()).isEqualTo(series.lastDate());
    }

    @Test
    void cryptoPairsAreKeyedBySymbolAndBase() {
        provider.put("SOLETH", TestSeriesFactory.startingAt(10).steps(9, 0.1).build());

        assertThat(provider.fetchSeries(Instrument.cryptoPair(2L, "sol", "eth"), 100).size()).isEqualTo(10);
        assertThat(provider.fetchSeries(Instrument.cryptoPair(3L, "SOL", "BTC"), 100).isEmpty()).isTrue();
    }
}
