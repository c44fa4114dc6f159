package com.example.cryptorates.domain;

import com.example.cryptorates.client.UnsupportedPairException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 지원하는 거래쌍 목록
 * 외부 표기(EUR/BTC)와 시세 제공처 심볼(BTCEUR)을 함께 보관
 */
public enum CryptoPair {

    EUR_BTC("EUR/BTC", "BTCEUR"),
    EUR_ETH("EUR/ETH", "ETHEUR"),
    EUR_LTC("EUR/LTC", "LTCEUR");

    private static final String SEPARATOR = "/";

    private final String symbol;
    private final String providerSymbol;

    CryptoPair(String symbol, String providerSymbol) {
        this.symbol = symbol;
        this.providerSymbol = providerSymbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getProviderSymbol() {
        return providerSymbol;
    }

    public String getBaseCurrency() {
        return symbol.substring(0, symbol.indexOf(SEPARATOR));
    }

    public String getQuoteCurrency() {
        return symbol.substring(symbol.indexOf(SEPARATOR) + 1);
    }

    public static Optional<CryptoPair> findBySymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(pair -> pair.symbol.equals(normalized))
                .findFirst();
    }

    public static Optional<CryptoPair> findByProviderSymbol(String providerSymbol) {
        return Arrays.stream(values())
                .filter(pair -> pair.providerSymbol.equals(providerSymbol))
                .findFirst();
    }

    /**
     * 외부 표기로 거래쌍 조회
     * @throws UnsupportedPairException 지원하지 않는 거래쌍
     */
    public static CryptoPair fromSymbol(String symbol) {
        return findBySymbol(symbol).orElseThrow(() -> new UnsupportedPairException(symbol));
    }

    public static List<CryptoPair> supported() {
        return List.of(values());
    }

    public static String supportedSymbols() {
        return Arrays.stream(values())
                .map(CryptoPair::getSymbol)
                .collect(Collectors.joining(", "));
    }
}
