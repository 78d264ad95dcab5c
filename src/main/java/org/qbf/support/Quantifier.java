package org.qbf.support;

/**
 * Tipo di quantificatore di un blocco del prefisso.
 * Il simbolo è quello usato nelle righe dei blocchi del formato QDIMACS.
 */
public enum Quantifier {
    EXISTENTIAL("e"),   // Esistenziale: e 1 2 3 0
    UNIVERSAL("a");     // Universale: a 4 5 0

    private final String symbol;

    Quantifier(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return simbolo QDIMACS del quantificatore ("e" oppure "a")
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Risolve il quantificatore dal simbolo della riga di blocco.
     *
     * @param symbol "e" oppure "a"
     * @return quantificatore corrispondente
     * @throws IllegalArgumentException se il simbolo non è riconosciuto
     */
    public static Quantifier fromSymbol(String symbol) {
        for (Quantifier quantifier : values()) {
            if (quantifier.symbol.equals(symbol)) {
                return quantifier;
            }
        }
        throw new IllegalArgumentException("Simbolo quantificatore non riconosciuto: " + symbol);
    }
}
