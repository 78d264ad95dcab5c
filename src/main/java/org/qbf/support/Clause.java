package org.qbf.support;

import java.util.*;

/**
 * CLAUSOLA - Disgiunzione di letterali in convenzione DIMACS
 *
 * Ogni letterale è un intero con segno:
 * - Valori positivi: variabile in forma positiva
 * - Valori negativi: variabile negata
 * - Lo zero non è mai un letterale (è il terminatore di riga nel formato testuale)
 *
 * Una clausola senza letterali è la clausola vuota e denota insoddisfacibilità.
 * L'ordine dei letterali è quello di inserimento e viene preservato in output.
 *
 * @param literals letterali della clausola (copia immutabile)
 */
public record Clause(List<Integer> literals) {

    public Clause {
        if (literals == null) {
            throw new IllegalArgumentException("Lista letterali non può essere null");
        }
        literals = List.copyOf(literals);
        for (Integer literal : literals) {
            if (literal == 0) {
                throw new IllegalArgumentException("Il letterale 0 non è ammesso in una clausola");
            }
        }
    }

    /**
     * Costruisce una clausola dai letterali forniti.
     */
    public static Clause of(int... literals) {
        List<Integer> values = new ArrayList<>(literals.length);
        for (int literal : literals) {
            values.add(literal);
        }
        return new Clause(values);
    }

    /**
     * @return clausola vuota (insoddisfacibile)
     */
    public static Clause empty() {
        return new Clause(List.of());
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public int size() {
        return literals.size();
    }

    /**
     * @return true se la clausola contiene un letterale sulla variabile indicata, con qualsiasi segno
     */
    public boolean mentions(int variable) {
        for (int literal : literals) {
            if (Math.abs(literal) == variable) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return riga DIMACS della clausola, terminatore incluso
     */
    @Override
    public String toString() {
        StringBuilder line = new StringBuilder();
        for (int literal : literals) {
            line.append(literal).append(' ');
        }
        return line.append('0').toString();
    }
}
