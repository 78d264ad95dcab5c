package org.qbf.split;

import org.qbf.support.Assignment;
import org.qbf.support.Formula;
import org.qbf.support.Quantifier;

import java.util.List;

/**
 * Un ramo dello split.
 *
 * @param index indice del ramo in [0, 2^d): in binario, la prima variabile fissata è il bit più significativo
 * @param assignment valori delle variabili fissate, nell'ordine del prefisso
 * @param splitQuantifiers quantificatore originale di ciascuna variabile fissata, stesso ordine
 * @param formula formula semplificata del ramo, posseduta interamente da questo risultato
 */
public record SplitResult(int index, Assignment assignment, List<Quantifier> splitQuantifiers, Formula formula) {

    public SplitResult {
        if (assignment == null || formula == null || splitQuantifiers == null) {
            throw new IllegalArgumentException("Assegnamento, quantificatori e formula sono obbligatori");
        }
        splitQuantifiers = List.copyOf(splitQuantifiers);
        if (splitQuantifiers.size() != assignment.size()) {
            throw new IllegalArgumentException("Un quantificatore per ogni variabile fissata: attesi "
                    + assignment.size() + ", ricevuti " + splitQuantifiers.size());
        }
    }

    public int depth() {
        return assignment.size();
    }

    /**
     * @return pattern 't'/'f' dell'assegnamento, stringa vuota per lo split a profondità 0
     */
    public String pattern() {
        return assignment.toPattern();
    }

    /**
     * @return true se tutte le variabili fissate erano esistenziali
     */
    public boolean isExistentialSplit() {
        return splitQuantifiers.stream().allMatch(q -> q == Quantifier.EXISTENTIAL);
    }
}
