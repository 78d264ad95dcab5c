package org.qbf.split;

import org.junit.jupiter.api.Test;
import org.qbf.support.Assignment;
import org.qbf.support.Clause;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClauseSimplifierTest {

    private final ClauseSimplifier simplifier = new ClauseSimplifier();

    // 1 = vero, 2 = falso
    private final Assignment assignment = Assignment.fromIndex(List.of(1, 2), 2);

    @Test
    void dropsSatisfiedClauses() {
        List<Clause> result = simplifier.simplify(List.of(Clause.of(1, 3), Clause.of(-2, 4)), assignment);

        assertThat(result).isEmpty();
    }

    @Test
    void removesFalseLiteralsKeepingOrder() {
        List<Clause> result = simplifier.simplify(List.of(Clause.of(3, -1, 4, 2, 5)), assignment);

        assertThat(result).containsExactly(Clause.of(3, 4, 5));
    }

    @Test
    void keepsEmptiedClauseAsEmptyClause() {
        List<Clause> result = simplifier.simplify(List.of(Clause.of(-1, 2), Clause.of(3)), assignment);

        assertThat(result).containsExactly(Clause.empty(), Clause.of(3));
    }

    @Test
    void returnsUntouchedClauseUnchanged() {
        Clause untouched = Clause.of(3, -4);

        assertThat(simplifier.simplifyClause(untouched, assignment)).isSameAs(untouched);
        assertThat(simplifier.simplifyClause(Clause.of(2, 1), assignment)).isNull();
    }

    @Test
    void doesNotPropagateUnitClauses() {
        List<Clause> result = simplifier.simplify(List.of(Clause.of(-1, 3), Clause.of(-3, 4)), assignment);

        assertThat(result).containsExactly(Clause.of(3), Clause.of(-3, 4));
    }

    @Test
    void leavesInputListUntouched() {
        List<Clause> input = List.of(Clause.of(-1, 3), Clause.of(1));

        simplifier.simplify(input, assignment);

        assertThat(input).containsExactly(Clause.of(-1, 3), Clause.of(1));
    }
}
