package org.qbf.split;

import org.qbf.support.Assignment;
import org.qbf.support.QuantifierBlock;

import java.util.*;
import java.util.logging.Logger;

/**
 * Riscrittura del prefisso di quantificatori dopo lo split.
 *
 * Le variabili fissate diventano costanti e spariscono dal prefisso, qualunque fosse il loro
 * quantificatore. I blocchi svuotati vengono eliminati; se l'eliminazione rende adiacenti
 * due blocchi dello stesso tipo, questi vengono fusi in uno solo. Le variabili universali
 * non fissate conservano il proprio quantificatore.
 *
 * Con gli assegnamenti di {@link FormulaSplitter}, che fissano sempre le prime variabili del
 * prefisso, i blocchi eliminati sono solo quelli iniziali e la fusione non avviene mai: serve
 * ai chiamanti che fissano variabili interne al prefisso.
 */
public class QuantifierRewriter {

    private static final Logger LOGGER = Logger.getLogger(QuantifierRewriter.class.getName());

    /**
     * @param blocks blocchi originali, nell'ordine del prefisso
     * @param assignment assegnamento parziale
     * @return nuova lista di blocchi senza le variabili assegnate
     */
    public List<QuantifierBlock> rewrite(List<QuantifierBlock> blocks, Assignment assignment) {
        if (blocks == null || assignment == null) {
            throw new IllegalArgumentException("Blocchi e assegnamento non possono essere null");
        }

        List<QuantifierBlock> rewritten = new ArrayList<>(blocks.size());
        boolean droppedSinceLastKept = false;

        for (QuantifierBlock block : blocks) {
            List<Integer> remaining = new ArrayList<>(block.variables().size());
            for (int variable : block.variables()) {
                if (!assignment.isAssigned(variable)) {
                    remaining.add(variable);
                }
            }

            if (remaining.isEmpty()) {
                LOGGER.finest("Blocco esaurito ed eliminato: " + block);
                droppedSinceLastKept = true;
                continue;
            }

            QuantifierBlock last = rewritten.isEmpty() ? null : rewritten.get(rewritten.size() - 1);
            if (droppedSinceLastKept && last != null && last.quantifier() == block.quantifier()) {
                List<Integer> merged = new ArrayList<>(last.variables());
                merged.addAll(remaining);
                rewritten.set(rewritten.size() - 1, new QuantifierBlock(block.quantifier(), merged));
            } else {
                rewritten.add(new QuantifierBlock(block.quantifier(), remaining));
            }
            droppedSinceLastKept = false;
        }

        return rewritten;
    }

    /**
     * Fonde ogni coppia di blocchi adiacenti con lo stesso quantificatore.
     * Usato quando un prefisso viene composto da più parti.
     */
    public List<QuantifierBlock> mergeAdjacent(List<QuantifierBlock> blocks) {
        List<QuantifierBlock> merged = new ArrayList<>(blocks.size());
        for (QuantifierBlock block : blocks) {
            QuantifierBlock last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && last.quantifier() == block.quantifier()) {
                List<Integer> variables = new ArrayList<>(last.variables());
                variables.addAll(block.variables());
                merged.set(merged.size() - 1, new QuantifierBlock(block.quantifier(), variables));
            } else {
                merged.add(block);
            }
        }
        return merged;
    }
}
