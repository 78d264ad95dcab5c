package org.qbf.split;

import org.junit.jupiter.api.Test;
import org.qbf.support.Assignment;
import org.qbf.support.QuantifierBlock;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.qbf.support.Quantifier.EXISTENTIAL;
import static org.qbf.support.Quantifier.UNIVERSAL;

class QuantifierRewriterTest {

    private final QuantifierRewriter rewriter = new QuantifierRewriter();

    @Test
    void removesAssignedVariablesFromTheirBlock() {
        List<QuantifierBlock> blocks = List.of(QuantifierBlock.of(EXISTENTIAL, 1, 2), QuantifierBlock.of(UNIVERSAL, 3));

        List<QuantifierBlock> result = rewriter.rewrite(blocks, Assignment.fromIndex(List.of(1), 0));

        assertThat(result).containsExactly(QuantifierBlock.of(EXISTENTIAL, 2), QuantifierBlock.of(UNIVERSAL, 3));
    }

    @Test
    void mergesNeighboursOfDroppedBlock() {
        List<QuantifierBlock> blocks = List.of(
                QuantifierBlock.of(EXISTENTIAL, 1),
                QuantifierBlock.of(UNIVERSAL, 2),
                QuantifierBlock.of(EXISTENTIAL, 3));

        List<QuantifierBlock> result = rewriter.rewrite(blocks, Assignment.fromIndex(List.of(2), 1));

        assertThat(result).containsExactly(QuantifierBlock.of(EXISTENTIAL, 1, 3));
    }

    @Test
    void dropsLeadingBlocksWithoutMerging() {
        List<QuantifierBlock> blocks = List.of(
                QuantifierBlock.of(EXISTENTIAL, 1),
                QuantifierBlock.of(UNIVERSAL, 2, 3),
                QuantifierBlock.of(EXISTENTIAL, 4));

        List<QuantifierBlock> result = rewriter.rewrite(blocks, Assignment.fromIndex(List.of(1, 2), 3));

        assertThat(result).containsExactly(QuantifierBlock.of(UNIVERSAL, 3), QuantifierBlock.of(EXISTENTIAL, 4));
    }

    @Test
    void keepsUnassignedUniversalsUniversal() {
        List<QuantifierBlock> blocks = List.of(QuantifierBlock.of(EXISTENTIAL, 1), QuantifierBlock.of(UNIVERSAL, 2));

        List<QuantifierBlock> result = rewriter.rewrite(blocks, Assignment.fromIndex(List.of(1), 1));

        assertThat(result).containsExactly(QuantifierBlock.of(UNIVERSAL, 2));
    }

    @Test
    void rewritingEverythingLeavesEmptyPrefix() {
        List<QuantifierBlock> blocks = List.of(QuantifierBlock.of(UNIVERSAL, 1), QuantifierBlock.of(EXISTENTIAL, 2));

        assertThat(rewriter.rewrite(blocks, Assignment.fromIndex(List.of(1, 2), 0))).isEmpty();
    }

    @Test
    void mergeAdjacentJoinsEverySameQuantifierRun() {
        List<QuantifierBlock> blocks = List.of(
                QuantifierBlock.of(EXISTENTIAL, 1),
                QuantifierBlock.of(EXISTENTIAL, 2, 3),
                QuantifierBlock.of(UNIVERSAL, 4),
                QuantifierBlock.of(UNIVERSAL, 5),
                QuantifierBlock.of(EXISTENTIAL, 6));

        assertThat(rewriter.mergeAdjacent(blocks)).containsExactly(
                QuantifierBlock.of(EXISTENTIAL, 1, 2, 3),
                QuantifierBlock.of(UNIVERSAL, 4, 5),
                QuantifierBlock.of(EXISTENTIAL, 6));
    }
}
