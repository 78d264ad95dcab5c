package org.qbf.split;

import org.qbf.support.Assignment;
import org.qbf.support.Clause;
import org.qbf.support.ErrorKind;
import org.qbf.support.Formula;
import org.qbf.support.FormulaException;
import org.qbf.support.ProblemHeader;
import org.qbf.support.Quantifier;
import org.qbf.support.QuantifierBlock;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SPLITTER DI FORMULE QBF - Enumerazione degli assegnamenti di un prefisso del quantificatore
 *
 * Fissa le prime d variabili del prefisso in tutti i 2^d modi possibili e produce, per
 * ciascun assegnamento, una formula semplificata e il relativo prefisso riscritto.
 *
 * ORDINE DI ENUMERAZIONE:
 * - L'indice k del ramo, letto in binario su d bit, codifica l'assegnamento
 * - La prima variabile del prefisso è il bit più significativo
 * - Bit 0 = falso, bit 1 = vero (falso enumerato prima di vero, in profondità)
 *
 * QUANTIFICATORI:
 * Le variabili universali producono entrambi i rami esattamente come le esistenziali.
 * La differenza tra i due tipi riguarda solo la ricomposizione dei risultati
 * (congiunzione per gli universali, selettori per gli esistenziali, vedi MergeFormulaBuilder).
 *
 * CONCORRENZA:
 * I rami sono indipendenti e possono essere calcolati su un pool di thread; i risultati
 * sono comunque consegnati in ordine di indice, identici all'esecuzione sequenziale.
 */
public class FormulaSplitter {

    private static final Logger LOGGER = Logger.getLogger(FormulaSplitter.class.getName());

    /** Profondità massima: 2^d rami devono essere indicizzabili con un int */
    public static final int MAX_DEPTH = 30;

    private final ClauseSimplifier clauseSimplifier;
    private final QuantifierRewriter quantifierRewriter;

    public FormulaSplitter() {
        this(new ClauseSimplifier(), new QuantifierRewriter());
    }

    public FormulaSplitter(ClauseSimplifier clauseSimplifier, QuantifierRewriter quantifierRewriter) {
        if (clauseSimplifier == null || quantifierRewriter == null) {
            throw new IllegalArgumentException("Semplificatore e riscrittore non possono essere null");
        }
        this.clauseSimplifier = clauseSimplifier;
        this.quantifierRewriter = quantifierRewriter;
    }

    //region SPLIT SEQUENZIALE

    /**
     * Calcola tutti i 2^d rami, in ordine di indice.
     *
     * @param formula formula da dividere
     * @param depth numero di variabili del prefisso da fissare
     * @return lista di 2^depth risultati; per depth = 0 un solo risultato con la formula originale
     * @throws FormulaException DEPTH_OUT_OF_RANGE se depth è negativa o supera il prefisso
     */
    public List<SplitResult> split(Formula formula, int depth) {
        List<SplitResult> results = new ArrayList<>();
        forEachSplit(formula, depth, results::add);
        return results;
    }

    /**
     * Consegna i rami uno alla volta senza trattenerli, in ordine di indice.
     * Adatto a scrivere ogni ramo su file e rilasciarlo subito.
     */
    public void forEachSplit(Formula formula, int depth, Consumer<SplitResult> consumer) {
        runSequential(prepare(formula, depth, consumer), consumer);
    }

    private void runSequential(SplitPlan plan, Consumer<SplitResult> consumer) {
        for (int index = 0; index < plan.branchCount(); index++) {
            consumer.accept(computeBranch(plan, index));
        }

        LOGGER.info("Split completato: " + plan.branchCount() + " rami generati");
    }

    //endregion

    //region SPLIT PARALLELO

    /**
     * Variante parallela di {@link #split(Formula, int)}: stesso risultato, stesso ordine.
     *
     * @param threads numero di thread del pool (almeno 1)
     */
    public List<SplitResult> splitInParallel(Formula formula, int depth, int threads) {
        List<SplitResult> results = new ArrayList<>();
        forEachSplitInParallel(formula, depth, threads, results::add);
        return results;
    }

    /**
     * Calcola i rami su un pool di thread e li consegna in ordine di indice.
     *
     * Al più 2 * threads rami sono in volo contemporaneamente, così la memoria resta
     * limitata anche per profondità elevate.
     */
    public void forEachSplitInParallel(Formula formula, int depth, int threads, Consumer<SplitResult> consumer) {
        if (threads < 1) {
            throw new IllegalArgumentException("Numero di thread deve essere almeno 1, ricevuto: " + threads);
        }
        SplitPlan plan = prepare(formula, depth, consumer);
        if (threads == 1 || plan.branchCount() == 1) {
            runSequential(plan, consumer);
            return;
        }

        int window = threads * 2;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Deque<Future<SplitResult>> pending = new ArrayDeque<>();
            int next = 0;
            while (next < plan.branchCount() || !pending.isEmpty()) {
                while (next < plan.branchCount() && pending.size() < window) {
                    final int index = next++;
                    pending.addLast(executor.submit(() -> computeBranch(plan, index)));
                }
                consumer.accept(awaitBranch(pending.removeFirst()));
            }
        } finally {
            executor.shutdownNow();
        }

        LOGGER.info("Split parallelo completato: " + plan.branchCount() + " rami su " + threads + " thread");
    }

    private SplitResult awaitBranch(Future<SplitResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Split interrotto", e);
        } catch (ExecutionException e) {
            LOGGER.log(Level.SEVERE, "Errore nel calcolo di un ramo", e.getCause());
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Calcolo del ramo fallito", e.getCause());
        }
    }

    //endregion

    //region CALCOLO DEI RAMI

    /**
     * Valida la profondità e fissa le variabili da dividere con i loro quantificatori.
     */
    private SplitPlan prepare(Formula formula, int depth, Consumer<SplitResult> consumer) {
        if (formula == null || consumer == null) {
            throw new IllegalArgumentException("Formula e consumer non possono essere null");
        }

        List<Integer> prefix = formula.getPrefix();
        if (depth < 0 || depth > prefix.size()) {
            throw new FormulaException(ErrorKind.DEPTH_OUT_OF_RANGE,
                    "Profondità " + depth + " fuori da [0, " + prefix.size() + "] (variabili nel prefisso)");
        }
        if (depth > MAX_DEPTH) {
            throw new FormulaException(ErrorKind.DEPTH_OUT_OF_RANGE,
                    "Profondità " + depth + " oltre il massimo supportato " + MAX_DEPTH);
        }

        List<Integer> variables = prefix.subList(0, depth);
        List<Quantifier> quantifiers = new ArrayList<>(depth);
        for (int variable : variables) {
            quantifiers.add(formula.quantifierOf(variable));
        }

        LOGGER.fine("Split a profondità " + depth + " sulle variabili " + variables + " " + quantifiers);
        return new SplitPlan(formula, List.copyOf(variables), List.copyOf(quantifiers), 1 << depth);
    }

    /**
     * Costruisce il ramo di indice dato: assegnamento, clausole semplificate e prefisso riscritto.
     */
    private SplitResult computeBranch(SplitPlan plan, int index) {
        Formula source = plan.formula();
        if (plan.variables().isEmpty()) {
            // Split identità: la formula è immutabile e può essere restituita così com'è
            return new SplitResult(0, Assignment.empty(), List.of(), source);
        }

        Assignment assignment = Assignment.fromIndex(plan.variables(), index);
        List<Clause> clauses = clauseSimplifier.simplify(source.getClauses(), assignment);
        List<QuantifierBlock> blocks = quantifierRewriter.rewrite(source.getQuantifierBlocks(), assignment);

        // Gli identificatori restano quelli originali: il limite dichiarato non cambia
        ProblemHeader header = new ProblemHeader(source.getHeader().variableCount(), clauses.size());
        Formula branch = new Formula(header, blocks, clauses, source.getDirectives());

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Ramo " + index + " (" + assignment.toPattern() + "): " + branch);
        }
        return new SplitResult(index, assignment, plan.quantifiers(), branch);
    }

    /**
     * Dati condivisi in sola lettura da tutti i rami di uno split.
     */
    private record SplitPlan(Formula formula, List<Integer> variables, List<Quantifier> quantifiers,
                             int branchCount) {}

    //endregion
}
