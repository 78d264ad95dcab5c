package org.qbf.support;

import java.util.List;

/**
 * Singolo vincolo di una direttiva intera: lista opzionale di variabili operando,
 * operatore di confronto e valore. Una lista operandi vuota indica che la lista è assente.
 *
 * @param operands variabili su cui il vincolo è definito (positive, eventualmente vuota)
 * @param comparison operatore di confronto
 * @param value lato destro, intero o pattern di bit
 */
public record IntegerConstraint(List<Integer> operands, Comparison comparison, ConstraintValue value) {

    public IntegerConstraint {
        if (comparison == null || value == null) {
            throw new IllegalArgumentException("Operatore e valore del vincolo sono obbligatori");
        }
        operands = operands == null ? List.of() : List.copyOf(operands);
        for (Integer operand : operands) {
            if (operand <= 0) {
                throw new IllegalArgumentException("Operando del vincolo non valido: " + operand);
            }
        }
    }

    public boolean hasOperands() {
        return !operands.isEmpty();
    }

    /**
     * @return forma testuale, ad esempio "[1 2 3] = {011}" oppure "< 5"
     */
    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        if (hasOperands()) {
            text.append('[');
            for (int i = 0; i < operands.size(); i++) {
                if (i > 0) {
                    text.append(' ');
                }
                text.append(operands.get(i));
            }
            text.append("] ");
        }
        return text.append(comparison.symbol()).append(' ').append(value).toString();
    }
}
