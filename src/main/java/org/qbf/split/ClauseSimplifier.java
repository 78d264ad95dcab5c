package org.qbf.split;

import org.qbf.support.Assignment;
import org.qbf.support.Clause;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SEMPLIFICAZIONE DELLE CLAUSOLE SOTTO UN ASSEGNAMENTO PARZIALE
 *
 * Sostituisce le variabili fissate con il loro valore costante:
 * - una clausola con un letterale vero è soddisfatta e viene eliminata
 * - i letterali falsi vengono rimossi dalle clausole che sopravvivono
 * - una clausola svuotata resta nella matrice come clausola vuota (ramo insoddisfacibile)
 * - le clausole senza variabili assegnate passano invariate
 *
 * Nessuna propagazione ulteriore: la clausola unitaria risultante non viene propagata.
 * L'operazione è puramente funzionale, quindi rami diversi possono essere semplificati
 * in parallelo sulla stessa lista di input.
 */
public class ClauseSimplifier {

    private static final Logger LOGGER = Logger.getLogger(ClauseSimplifier.class.getName());

    /**
     * @param clauses clausole originali (non modificate)
     * @param assignment assegnamento parziale
     * @return nuova lista di clausole semplificate, ordine preservato
     */
    public List<Clause> simplify(List<Clause> clauses, Assignment assignment) {
        if (clauses == null || assignment == null) {
            throw new IllegalArgumentException("Clausole e assegnamento non possono essere null");
        }

        List<Clause> simplified = new ArrayList<>(clauses.size());
        int satisfied = 0;
        int emptied = 0;

        for (Clause clause : clauses) {
            Clause result = simplifyClause(clause, assignment);
            if (result == null) {
                satisfied++;
                continue;
            }
            if (result.isEmpty() && !clause.isEmpty()) {
                emptied++;
            }
            simplified.add(result);
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Semplificazione %s: %d clausole soddisfatte, %d svuotate, %d rimaste",
                    assignment.toPattern(), satisfied, emptied, simplified.size()));
        }
        return simplified;
    }

    /**
     * @return clausola semplificata, oppure null se soddisfatta dall'assegnamento
     */
    Clause simplifyClause(Clause clause, Assignment assignment) {
        List<Integer> remaining = null;

        for (int i = 0; i < clause.size(); i++) {
            int literal = clause.literals().get(i);
            Boolean value = assignment.evaluate(literal);
            if (Boolean.TRUE.equals(value)) {
                return null;
            }
            if (Boolean.FALSE.equals(value) && remaining == null) {
                // Primo letterale falso: da qui in poi serve una copia filtrata
                remaining = new ArrayList<>(clause.literals().subList(0, i));
            } else if (value == null && remaining != null) {
                remaining.add(literal);
            }
        }

        return remaining == null ? clause : new Clause(remaining);
    }
}
