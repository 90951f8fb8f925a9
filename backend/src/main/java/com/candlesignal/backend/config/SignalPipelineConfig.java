package com.candlesignal.backend.config;

import com.candlesignal.backend.signal.pipeline.CandleSeriesProvider;
import com.candlesignal.backend.signal.pipeline.InMemoryCandleSeriesProvider;
import com.candlesignal.backend.signal.pipeline.InMemorySignalStore;
import com.candlesignal.backend.signal.pipeline.SignalStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-memory collaborators, used until a real market data source or database is wired in.
 */
@Configuration
public class SignalPipelineConfig {

    @Bean
    @ConditionalOnMissingBean(CandleSeriesProvider.class)
    public CandleSeriesProvider candleSeriesProvider() {
        return new InMemoryCandleSeriesProvider();
    }

    @Bean
    @ConditionalOnMissingBean(SignalStore.class)
    public SignalStore signalStore() {
        return new InMemorySignalStore();
    }
}
