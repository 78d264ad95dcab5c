package org.qbf.support;

import java.util.*;

/**
 * FORMULA QBF - Modello strutturale di un documento QDIMACS esteso
 *
 * Raccoglie la riga problema, il prefisso di quantificatori organizzato in blocchi,
 * la matrice di clausole e le direttive di assunzione intere del preambolo.
 *
 * INVARIANTI MANTENUTE:
 * - Tutte le liste sono immutabili dopo costruzione
 * - L'ordine dei blocchi è l'ordine di dipendenza del prefisso
 * - La concatenazione delle variabili dei blocchi definisce il prefisso usato dallo split
 *
 * La validazione degli identificatori rispetto alla riga problema è responsabilità
 * del parser, che conosce la posizione di ogni elemento nel testo.
 */
public final class Formula {

    private final ProblemHeader header;
    private final List<QuantifierBlock> quantifierBlocks;
    private final List<Clause> clauses;
    private final List<AssumptionDirective> directives;

    public Formula(ProblemHeader header, List<QuantifierBlock> quantifierBlocks,
                   List<Clause> clauses, List<AssumptionDirective> directives) {
        if (header == null) {
            throw new IllegalArgumentException("Riga problema non può essere null");
        }
        if (quantifierBlocks == null || clauses == null || directives == null) {
            throw new IllegalArgumentException("Blocchi, clausole e direttive non possono essere null");
        }
        this.header = header;
        this.quantifierBlocks = List.copyOf(quantifierBlocks);
        this.clauses = List.copyOf(clauses);
        this.directives = List.copyOf(directives);
    }

    public ProblemHeader getHeader() {
        return header;
    }

    public List<QuantifierBlock> getQuantifierBlocks() {
        return quantifierBlocks;
    }

    public List<Clause> getClauses() {
        return clauses;
    }

    public List<AssumptionDirective> getDirectives() {
        return directives;
    }

    /**
     * @return variabili del prefisso di quantificatori, blocco dopo blocco, nell'ordine del file
     */
    public List<Integer> getPrefix() {
        List<Integer> prefix = new ArrayList<>();
        for (QuantifierBlock block : quantifierBlocks) {
            prefix.addAll(block.variables());
        }
        return Collections.unmodifiableList(prefix);
    }

    /**
     * @return quantificatore della variabile, oppure null se la variabile è libera
     */
    public Quantifier quantifierOf(int variable) {
        for (QuantifierBlock block : quantifierBlocks) {
            if (block.contains(variable)) {
                return block.quantifier();
            }
        }
        return null;
    }

    /**
     * Identificatore di variabile più alto effettivamente usato da prefisso, clausole
     * e liste operandi delle direttive. Zero se la formula non usa variabili.
     */
    public int getMaxVariable() {
        int max = 0;
        for (QuantifierBlock block : quantifierBlocks) {
            for (int variable : block.variables()) {
                max = Math.max(max, variable);
            }
        }
        for (Clause clause : clauses) {
            for (int literal : clause.literals()) {
                max = Math.max(max, Math.abs(literal));
            }
        }
        for (AssumptionDirective directive : directives) {
            for (IntegerConstraint constraint : directive.constraints()) {
                for (int operand : constraint.operands()) {
                    max = Math.max(max, operand);
                }
            }
        }
        return max;
    }

    /**
     * @return true se la matrice contiene la clausola vuota
     */
    public boolean containsEmptyClause() {
        return clauses.stream().anyMatch(Clause::isEmpty);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Formula that)) {
            return false;
        }
        return header.equals(that.header)
                && quantifierBlocks.equals(that.quantifierBlocks)
                && clauses.equals(that.clauses)
                && directives.equals(that.directives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, quantifierBlocks, clauses, directives);
    }

    @Override
    public String toString() {
        return String.format("Formula{%s, blocchi=%d, prefisso=%d, clausole=%d, direttive=%d}",
                header, quantifierBlocks.size(), getPrefix().size(), clauses.size(), directives.size());
    }
}
