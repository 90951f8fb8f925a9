package com.candlesignal.backend.model;

import java.util.Locale;

/**
 * A tradable instrument as known to the ticker collaborator.
 *
 * @param baseAsset quote side of a crypto pair (ETH, BTC); {@code null} for stocks
 */
public record Instrument(Long id, String symbol, String exchange, MarketType marketType, String baseAsset) {

    public static Instrument stock(Long id, String symbol, String exchange) {
        return new Instrument(id, symbol, exchange, MarketType.STOCK, null);
    }

    public static Instrument cryptoPair(Long id, String symbol, String baseAsset) {
        return new Instrument(id, symbol, "BINANCE", MarketType.CRYPTO, baseAsset);
    }

    public boolean isCrypto() {
        return marketType == MarketType.CRYPTO;
    }

    /**
     * Symbol as the market data source expects it.
     */
    public String dataSymbol() {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if (isCrypto()) {
            return baseAsset == null ? normalized : normalized + baseAsset.trim().toUpperCase(Locale.ROOT);
        }
        if ("ASX".equalsIgnoreCase(exchange) && !normalized.endsWith(".AX")) {
            return normalized + ".AX";
        }
        return normalized;
    }

    public String displayName() {
        return isCrypto() && baseAsset != null ? symbol + "/" + baseAsset : symbol + " (" + exchange + ")";
    }
}
