package org.qbf.support;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormulaTest {

    private final Formula formula = new Formula(
            new ProblemHeader(9, 2),
            List.of(QuantifierBlock.of(Quantifier.EXISTENTIAL, 1, 2),
                    QuantifierBlock.of(Quantifier.UNIVERSAL, 3),
                    QuantifierBlock.of(Quantifier.EXISTENTIAL, 4)),
            List.of(Clause.of(1, -3), Clause.of(-4, 6)),
            List.of());

    @Test
    void prefixConcatenatesBlocksInOrder() {
        assertThat(formula.getPrefix()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void quantifierOfFreeVariableIsNull() {
        assertThat(formula.quantifierOf(3)).isEqualTo(Quantifier.UNIVERSAL);
        assertThat(formula.quantifierOf(4)).isEqualTo(Quantifier.EXISTENTIAL);
        assertThat(formula.quantifierOf(6)).isNull();
    }

    @Test
    void maxVariableIgnoresDeclaredBound() {
        assertThat(formula.getMaxVariable()).isEqualTo(6);
    }

    @Test
    void clauseRejectsZeroLiteral() {
        assertThatThrownBy(() -> Clause.of(1, 0, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clauseAndBlockRenderAsQdimacsLines() {
        assertThat(Clause.of(1, -2)).hasToString("1 -2 0");
        assertThat(Clause.empty()).hasToString("0");
        assertThat(QuantifierBlock.of(Quantifier.UNIVERSAL, 4, 5)).hasToString("a 4 5 0");
    }
}
