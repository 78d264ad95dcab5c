package org.qbf.split;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.qbf.qdimacs.QdimacsFormulaParser;
import org.qbf.support.Assignment;
import org.qbf.support.Clause;
import org.qbf.support.ErrorKind;
import org.qbf.support.Formula;
import org.qbf.support.FormulaException;
import org.qbf.support.ProblemHeader;
import org.qbf.support.Quantifier;
import org.qbf.support.QuantifierBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormulaSplitterTest {

    private static final String EXAMPLE = "p cnf 3 2\ne 1 2 3 0\n1 2 0\n-1 3 0\n";

    private static final String MIXED = """
            p cnf 6 5
            e 1 2 0
            a 3 0
            e 4 5 6 0
            1 -3 4 0
            -1 2 0
            -2 3 5 0
            -4 -5 6 0
            1 2 3 0
            """;

    private final QdimacsFormulaParser parser = new QdimacsFormulaParser();
    private final FormulaSplitter splitter = new FormulaSplitter();

    @Test
    @DisplayName("Split della prima variabile: un ramo per valore, clausole e prefisso semplificati")
    void splitsFirstVariable() {
        List<SplitResult> results = splitter.split(parser.parse(EXAMPLE), 1);

        assertThat(results).hasSize(2);

        SplitResult falseBranch = results.get(0);
        assertThat(falseBranch.index()).isZero();
        assertThat(falseBranch.pattern()).isEqualTo("f");
        assertThat(falseBranch.formula().getClauses()).containsExactly(Clause.of(2));
        assertThat(falseBranch.formula().getQuantifierBlocks())
                .containsExactly(QuantifierBlock.of(Quantifier.EXISTENTIAL, 2, 3));

        SplitResult trueBranch = results.get(1);
        assertThat(trueBranch.index()).isEqualTo(1);
        assertThat(trueBranch.pattern()).isEqualTo("t");
        assertThat(trueBranch.formula().getClauses()).containsExactly(Clause.of(3));
        assertThat(trueBranch.formula().getQuantifierBlocks())
                .containsExactly(QuantifierBlock.of(Quantifier.EXISTENTIAL, 2, 3));
    }

    @Test
    void branchHeaderKeepsDeclaredVariablesAndCountsClauses() {
        List<SplitResult> results = splitter.split(parser.parse(MIXED), 2);

        for (SplitResult result : results) {
            ProblemHeader header = result.formula().getHeader();
            assertThat(header.variableCount()).isEqualTo(6);
            assertThat(header.clauseCount()).isEqualTo(result.formula().getClauses().size());
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4})
    void producesOneBranchPerAssignment(int depth) {
        List<SplitResult> results = splitter.split(parser.parse(MIXED), depth);

        assertThat(results).hasSize(1 << depth);
        for (int i = 0; i < results.size(); i++) {
            assertThat(results.get(i).index()).isEqualTo(i);
            assertThat(results.get(i).depth()).isEqualTo(depth);
        }
    }

    @Test
    @DisplayName("Gli assegnamenti coprono tutte le combinazioni, prima variabile più significativa")
    void enumeratesAssignmentsMostSignificantFirst() {
        List<SplitResult> results = splitter.split(parser.parse(MIXED), 3);

        List<String> patterns = results.stream().map(SplitResult::pattern).collect(Collectors.toList());
        assertThat(patterns).containsExactly("fff", "fft", "ftf", "ftt", "tff", "tft", "ttf", "ttt");

        List<Assignment> assignments = results.stream().map(SplitResult::assignment).collect(Collectors.toList());
        assertThat(assignments).doesNotHaveDuplicates();
        assertThat(assignments).allSatisfy(a -> assertThat(a.getVariables()).containsExactly(1, 2, 3));
    }

    @Test
    void depthZeroReturnsOriginalFormula() {
        Formula formula = parser.parse(MIXED);

        List<SplitResult> results = splitter.split(formula, 0);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).formula()).isSameAs(formula);
        assertThat(results.get(0).pattern()).isEmpty();
        assertThat(results.get(0).isExistentialSplit()).isTrue();
    }

    @Test
    void universalVariablesAreSplitLikeExistentials() {
        Formula formula = parser.parse("p cnf 2 1\na 1 0\ne 2 0\n1 2 0\n");

        List<SplitResult> results = splitter.split(formula, 1);

        assertThat(results).hasSize(2);
        assertThat(results).allSatisfy(r -> {
            assertThat(r.splitQuantifiers()).containsExactly(Quantifier.UNIVERSAL);
            assertThat(r.isExistentialSplit()).isFalse();
            assertThat(r.formula().getQuantifierBlocks()).containsExactly(QuantifierBlock.of(Quantifier.EXISTENTIAL, 2));
        });
        assertThat(results.get(0).formula().getClauses()).containsExactly(Clause.of(2));
        assertThat(results.get(1).formula().getClauses()).isEmpty();
    }

    @Test
    void falsifiedClauseBecomesEmptyClause() {
        Formula formula = parser.parse("p cnf 2 2\ne 1 2 0\n1 0\n2 0\n");

        List<SplitResult> results = splitter.split(formula, 1);

        assertThat(results.get(0).formula().containsEmptyClause()).isTrue();
        assertThat(results.get(0).formula().getClauses()).containsExactly(Clause.empty(), Clause.of(2));
        assertThat(results.get(1).formula().containsEmptyClause()).isFalse();
    }

    @Test
    void directivesArePassedToEveryBranch() {
        Formula formula = parser.parse("s int [1 2] = 3\np cnf 2 1\ne 1 2 0\n1 2 0\n");

        assertThat(splitter.split(formula, 2))
                .allSatisfy(r -> assertThat(r.formula().getDirectives()).isEqualTo(formula.getDirectives()));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 7})
    void rejectsDepthOutsidePrefix(int depth) {
        Formula formula = parser.parse(MIXED);

        assertThatThrownBy(() -> splitter.split(formula, depth))
                .isInstanceOfSatisfying(FormulaException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.DEPTH_OUT_OF_RANGE));
    }

    @Test
    void rejectsDepthAboveSupportedMaximum() {
        StringBuilder text = new StringBuilder("p cnf 31 1\ne");
        for (int variable = 1; variable <= 31; variable++) {
            text.append(' ').append(variable);
        }
        text.append(" 0\n1 0\n");
        Formula formula = parser.parse(text.toString());

        assertThatThrownBy(() -> splitter.split(formula, FormulaSplitter.MAX_DEPTH + 1))
                .isInstanceOfSatisfying(FormulaException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.DEPTH_OUT_OF_RANGE));
    }

    //region PARALLELO

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 8})
    void parallelSplitMatchesSequentialSplit(int threads) {
        Formula formula = parser.parse(MIXED);

        List<SplitResult> sequential = splitter.split(formula, 4);
        List<SplitResult> parallel = splitter.splitInParallel(formula, 4, threads);

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void streamingDeliversBranchesInIndexOrder() {
        List<Integer> indices = new ArrayList<>();

        splitter.forEachSplitInParallel(parser.parse(MIXED), 5, 3, r -> indices.add(r.index()));

        assertThat(indices).hasSize(32).isSorted();
    }

    @Test
    void rejectsNonPositiveThreadCount() {
        Formula formula = parser.parse(EXAMPLE);

        assertThatThrownBy(() -> splitter.splitInParallel(formula, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    //endregion
}
