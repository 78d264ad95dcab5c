package org.qbf.merge;

import org.qbf.split.QuantifierRewriter;
import org.qbf.split.SplitResult;
import org.qbf.support.AssumptionDirective;
import org.qbf.support.Clause;
import org.qbf.support.Formula;
import org.qbf.support.ProblemHeader;
import org.qbf.support.Quantifier;
import org.qbf.support.QuantifierBlock;

import java.util.*;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DELLA FORMULA DI MERGE - Ricomposizione dei rami di uno split esistenziale
 *
 * Costruisce un'unica formula ausiliaria i cui modelli scelgono, tramite una variabile
 * selettore per ramo, quale ramo dello split è attivo. Un modello della formula di merge
 * contiene quindi sia l'assegnamento delle variabili fissate dallo split sia quello delle
 * variabili restanti, cioè un modello della formula originale.
 *
 * STRUTTURA GENERATA (n rami, V = limite variabili dei rami):
 * - Selettori: s_i = V + 1 + i, uno per ramo
 * - Prefisso: e [variabili fissate] [selettori], seguito dal prefisso comune dei rami
 * - Clausola (s_0 | ... | s_{n-1}): almeno un ramo è attivo
 * - Per ogni ramo i e variabile fissata x: (!s_i | x) oppure (!s_i | !x) secondo il valore nel ramo
 * - Per ogni clausola C del ramo i: (!s_i | C); la clausola vuota diventa (!s_i)
 *
 * Le variabili non fissate sono condivise da tutti i rami con i loro identificatori originali.
 * Solo gli split su variabili esistenziali sono ricomponibili con i selettori: i rami
 * universali si ricompongono per congiunzione e non richiedono questa formula.
 */
public class MergeFormulaBuilder {

    private static final Logger LOGGER = Logger.getLogger(MergeFormulaBuilder.class.getName());

    private final QuantifierRewriter quantifierRewriter;

    public MergeFormulaBuilder() {
        this(new QuantifierRewriter());
    }

    public MergeFormulaBuilder(QuantifierRewriter quantifierRewriter) {
        this.quantifierRewriter = quantifierRewriter;
    }

    /**
     * Costruisce la formula di merge.
     *
     * @param results rami di un unico split, in ordine di indice (0..n-1)
     * @return formula ausiliaria con selettori
     * @throws IllegalArgumentException se la lista è vuota, incoerente o contiene variabili fissate universali
     */
    public Formula build(List<SplitResult> results) {
        validateResults(results);

        SplitResult first = results.get(0);
        List<Integer> splitVariables = first.assignment().getVariables();
        int variableBound = maxVariableBound(results);

        LOGGER.info("Costruzione formula di merge: " + results.size() + " rami, "
                + splitVariables.size() + " variabili fissate");

        List<Integer> selectors = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            selectors.add(variableBound + 1 + i);
        }

        List<QuantifierBlock> blocks = buildPrefix(first, splitVariables, selectors);
        List<Clause> clauses = buildClauses(results, selectors);

        ProblemHeader header = new ProblemHeader(variableBound + selectors.size(), clauses.size());
        List<AssumptionDirective> directives = first.formula().getDirectives();

        Formula merged = new Formula(header, blocks, clauses, directives);
        LOGGER.fine("Formula di merge costruita: " + merged);
        return merged;
    }

    //region VALIDAZIONE

    private void validateResults(List<SplitResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno un ramo per costruire la formula di merge");
        }

        List<Integer> splitVariables = results.get(0).assignment().getVariables();
        int expectedCount = 1 << splitVariables.size();
        if (results.size() != expectedCount) {
            throw new IllegalArgumentException("Attesi " + expectedCount + " rami per "
                    + splitVariables.size() + " variabili fissate, ricevuti " + results.size());
        }

        for (int i = 0; i < results.size(); i++) {
            SplitResult result = results.get(i);
            if (result.index() != i) {
                throw new IllegalArgumentException("Ramo in posizione " + i + " ha indice " + result.index());
            }
            if (!result.assignment().getVariables().equals(splitVariables)) {
                throw new IllegalArgumentException("Il ramo " + i + " fissa variabili diverse: "
                        + result.assignment().getVariables() + " invece di " + splitVariables);
            }
            if (!result.isExistentialSplit()) {
                throw new IllegalArgumentException("Il ramo " + i + " fissa variabili universali: "
                        + "i rami universali si ricompongono per congiunzione, non con selettori");
            }
        }
    }

    private int maxVariableBound(List<SplitResult> results) {
        int bound = 0;
        for (SplitResult result : results) {
            bound = Math.max(bound, result.formula().getHeader().variableCount());
            bound = Math.max(bound, result.formula().getMaxVariable());
            for (int variable : result.assignment().getVariables()) {
                bound = Math.max(bound, variable);
            }
        }
        return bound;
    }

    //endregion

    //region COSTRUZIONE PREFISSO E CLAUSOLE

    /**
     * Le variabili fissate e i selettori sono esistenziali e precedono il prefisso dei rami,
     * identico in tutti i rami perché tutti eliminano le stesse variabili.
     */
    private List<QuantifierBlock> buildPrefix(SplitResult first, List<Integer> splitVariables, List<Integer> selectors) {
        List<Integer> outermost = new ArrayList<>(splitVariables);
        outermost.addAll(selectors);

        List<QuantifierBlock> blocks = new ArrayList<>();
        blocks.add(new QuantifierBlock(Quantifier.EXISTENTIAL, outermost));
        blocks.addAll(first.formula().getQuantifierBlocks());
        return quantifierRewriter.mergeAdjacent(blocks);
    }

    private List<Clause> buildClauses(List<SplitResult> results, List<Integer> selectors) {
        List<Clause> clauses = new ArrayList<>();
        clauses.add(new Clause(selectors));

        for (int i = 0; i < results.size(); i++) {
            SplitResult result = results.get(i);
            int guard = -selectors.get(i);

            // Il selettore attivo fissa le variabili dello split al valore del ramo
            for (int literal : result.assignment().getTrueLiterals()) {
                clauses.add(Clause.of(guard, literal));
            }

            for (Clause clause : result.formula().getClauses()) {
                List<Integer> guarded = new ArrayList<>(clause.size() + 1);
                guarded.add(guard);
                guarded.addAll(clause.literals());
                clauses.add(new Clause(guarded));
            }
        }
        return clauses;
    }

    //endregion
}
