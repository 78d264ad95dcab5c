package org.qbf.support;

/**
 * Riga problema "p cnf V C".
 * Il numero di variabili è il limite superiore usato per validare gli identificatori,
 * il numero di clausole è solo indicativo.
 *
 * @param variableCount numero di variabili dichiarato
 * @param clauseCount numero di clausole dichiarato
 */
public record ProblemHeader(int variableCount, int clauseCount) {

    public ProblemHeader {
        if (variableCount < 0 || clauseCount < 0) {
            throw new IllegalArgumentException("Conteggi della riga problema negativi: p cnf "
                    + variableCount + " " + clauseCount);
        }
    }

    @Override
    public String toString() {
        return "p cnf " + variableCount + " " + clauseCount;
    }
}
