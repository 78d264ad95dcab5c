package org.qbf.support;

/**
 * Operatore di confronto di un vincolo intero.
 */
public enum Comparison {
    LESS_THAN("<"),
    GREATER_THAN(">"),
    EQUALS("=");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Comparison fromSymbol(String symbol) {
        for (Comparison comparison : values()) {
            if (comparison.symbol.equals(symbol)) {
                return comparison;
            }
        }
        throw new IllegalArgumentException("Operatore di confronto non riconosciuto: " + symbol);
    }
}
