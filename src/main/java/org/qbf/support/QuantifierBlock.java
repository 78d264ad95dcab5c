package org.qbf.support;

import java.util.*;

/**
 * Blocco di quantificatori: un tipo di quantificatore e la lista ordinata delle variabili
 * che quantifica. L'ordine dei blocchi nel file è l'ordine di dipendenza del prefisso.
 *
 * @param quantifier tipo del blocco
 * @param variables variabili quantificate, tutte positive, almeno una
 */
public record QuantifierBlock(Quantifier quantifier, List<Integer> variables) {

    public QuantifierBlock {
        if (quantifier == null) {
            throw new IllegalArgumentException("Quantificatore non può essere null");
        }
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("Un blocco di quantificatori richiede almeno una variabile");
        }
        variables = List.copyOf(variables);
        for (Integer variable : variables) {
            if (variable <= 0) {
                throw new IllegalArgumentException("Variabile quantificata non valida: " + variable);
            }
        }
    }

    public static QuantifierBlock of(Quantifier quantifier, int... variables) {
        List<Integer> values = new ArrayList<>(variables.length);
        for (int variable : variables) {
            values.add(variable);
        }
        return new QuantifierBlock(quantifier, values);
    }

    public boolean contains(int variable) {
        return variables.contains(variable);
    }

    /**
     * @return riga QDIMACS del blocco, ad esempio "e 1 2 3 0"
     */
    @Override
    public String toString() {
        StringBuilder line = new StringBuilder(quantifier.symbol());
        for (int variable : variables) {
            line.append(' ').append(variable);
        }
        return line.append(" 0").toString();
    }
}
