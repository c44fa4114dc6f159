package com.example.cryptorates.client;

import com.example.cryptorates.domain.CryptoPair;

public class UnsupportedPairException extends PriceSourceException {

    public UnsupportedPairException(String pair) {
        super("Unsupported trading pair: " + pair + ". Supported pairs: " + CryptoPair.supportedSymbols(), pair, null);
    }

    @Override
    public Kind getKind() {
        return Kind.UNSUPPORTED_PAIR;
    }
}
