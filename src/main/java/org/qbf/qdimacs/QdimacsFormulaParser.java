package org.qbf.qdimacs;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.qbf.parser.QdimacsBaseVisitor;
import org.qbf.parser.QdimacsLexer;
import org.qbf.parser.QdimacsParser;
import org.qbf.parser.QdimacsParser.ClauseLineContext;
import org.qbf.parser.QdimacsParser.ConstraintContext;
import org.qbf.parser.QdimacsParser.DirectiveLineContext;
import org.qbf.parser.QdimacsParser.FileContext;
import org.qbf.parser.QdimacsParser.PreambleLineContext;
import org.qbf.parser.QdimacsParser.ProblemLineContext;
import org.qbf.parser.QdimacsParser.QuantifierLineContext;
import org.qbf.parser.QdimacsParser.ValueContext;
import org.qbf.support.AssumptionDirective;
import org.qbf.support.Clause;
import org.qbf.support.Comparison;
import org.qbf.support.ConstraintValue;
import org.qbf.support.ErrorKind;
import org.qbf.support.Formula;
import org.qbf.support.FormulaException;
import org.qbf.support.IntegerConstraint;
import org.qbf.support.ProblemHeader;
import org.qbf.support.Quantifier;
import org.qbf.support.QuantifierBlock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * PARSER QDIMACS ESTESO - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa un visitor sulla grammatica Qdimacs che ricostruisce il modello strutturale
 * del documento e ne valida la semantica che la grammatica non può esprimere.
 *
 * VALIDAZIONI ESEGUITE:
 * - Identificatori nei blocchi e nelle clausole entro il limite della riga problema
 * - Variabili quantificate positive e presenti in un solo blocco
 * - Terminatore 0 presente su ogni riga di blocco e di clausola
 * - Operandi delle direttive positivi
 *
 * Gli errori sintattici sono convertiti da {@link SyntaxErrorListener}; quelli semantici
 * sono sollevati qui, sempre con la posizione del token che li ha causati.
 *
 * Un'istanza conserva lo stato del documento in analisi e non è thread-safe:
 * ogni chiamata a {@link #parse(String)} riparte da uno stato pulito.
 */
public class QdimacsFormulaParser extends QdimacsBaseVisitor<Void> {

    private static final Logger LOGGER = Logger.getLogger(QdimacsFormulaParser.class.getName());

    //region STATO DEL DOCUMENTO

    private ProblemHeader header;
    private List<QuantifierBlock> quantifierBlocks;
    private List<Clause> clauses;
    private List<AssumptionDirective> directives;

    /** Variabili già quantificate, per rilevare quantificazioni duplicate */
    private Set<Integer> quantifiedVariables;

    //endregion

    //region PUNTO DI INGRESSO

    /**
     * Analizza il testo di una formula QDIMACS esteso.
     *
     * PIPELINE:
     * 1. Lexing e parsing ANTLR con listener che solleva al primo errore
     * 2. Visita dell'albero: preambolo, riga problema, blocchi, clausole
     * 3. Costruzione della formula immutabile
     *
     * @param text contenuto del documento
     * @return formula analizzata
     * @throws FormulaException se il documento è malformato o semanticamente non valido
     */
    public Formula parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }
        resetState();

        CharStream input = CharStreams.fromString(text);
        QdimacsLexer lexer = new QdimacsLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        QdimacsParser parser = new QdimacsParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);

        FileContext tree = parser.file();
        visit(tree);

        Formula formula = new Formula(header, quantifierBlocks, clauses, directives);
        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    /**
     * Legge e analizza un file QDIMACS.
     *
     * @param path percorso del file
     * @return formula analizzata
     * @throws IOException se il file non è leggibile
     */
    public Formula parse(Path path) throws IOException {
        LOGGER.info("Lettura formula da " + path);
        return parse(Files.readString(path));
    }

    private void resetState() {
        this.header = null;
        this.quantifierBlocks = new ArrayList<>();
        this.clauses = new ArrayList<>();
        this.directives = new ArrayList<>();
        this.quantifiedVariables = new HashSet<>();
    }

    //endregion

    //region DOCUMENTO E PREAMBOLO

    @Override
    public Void visitFile(FileContext ctx) {
        for (PreambleLineContext preambleLine : ctx.preambleLine()) {
            visit(preambleLine);
        }
        visit(ctx.problemLine());
        for (QuantifierLineContext quantifierLine : ctx.quantifierLine()) {
            visit(quantifierLine);
        }
        for (ClauseLineContext clauseLine : ctx.clauseLine()) {
            visit(clauseLine);
        }

        if (clauses.size() != header.clauseCount()) {
            LOGGER.warning("Numero clausole dichiarato " + header.clauseCount()
                    + " diverso da quello letto " + clauses.size());
        }
        return null;
    }

    @Override
    public Void visitPreambleLine(PreambleLineContext ctx) {
        // I commenti sono scartati
        if (ctx.directiveLine() != null) {
            visit(ctx.directiveLine());
        }
        return null;
    }

    /**
     * Direttiva intera: prefisso "cs int"/"s int" e vincoli concatenati con ';'.
     * I valori sono conservati come dati strutturati, senza interpretazione.
     */
    @Override
    public Void visitDirectiveLine(DirectiveLineContext ctx) {
        List<IntegerConstraint> constraints = new ArrayList<>();
        for (ConstraintContext constraintCtx : ctx.constraint()) {
            constraints.add(buildConstraint(constraintCtx));
        }

        String marker = AssumptionDirective.normalizeMarker(ctx.INT_SPLIT().getText());
        directives.add(new AssumptionDirective(marker, constraints));
        LOGGER.finest("Direttiva letta: " + directives.get(directives.size() - 1));
        return null;
    }

    private IntegerConstraint buildConstraint(ConstraintContext ctx) {
        List<Integer> operands = new ArrayList<>();
        if (ctx.operandList() != null) {
            for (TerminalNode operandNode : ctx.operandList().NUMBER()) {
                int operand = parseInteger(operandNode);
                if (operand <= 0) {
                    throw errorAt(ErrorKind.MALFORMED_LINE, operandNode.getSymbol(),
                            "Operando della direttiva deve essere positivo: " + operand);
                }
                operands.add(operand);
            }
        }

        Comparison comparison = Comparison.fromSymbol(ctx.comparison().getText());
        return new IntegerConstraint(operands, comparison, buildValue(ctx.value()));
    }

    private ConstraintValue buildValue(ValueContext ctx) {
        if (ctx.BITS() != null) {
            String text = ctx.BITS().getText();
            return ConstraintValue.ofBitPattern(text.substring(1, text.length() - 1));
        }
        TerminalNode node = ctx.NUMBER() != null ? ctx.NUMBER() : ctx.ZERO();
        try {
            return ConstraintValue.ofInteger(Long.parseLong(node.getText()));
        } catch (NumberFormatException e) {
            throw errorAt(ErrorKind.MALFORMED_LINE, node.getSymbol(), "Valore intero non rappresentabile: " + node.getText());
        }
    }

    //endregion

    //region RIGA PROBLEMA, BLOCCHI E CLAUSOLE

    @Override
    public Void visitProblemLine(ProblemLineContext ctx) {
        int variableCount = parseCount(ctx.variables.getStart());
        int clauseCount = parseCount(ctx.clauses.getStart());
        header = new ProblemHeader(variableCount, clauseCount);
        LOGGER.fine("Riga problema: " + header);
        return null;
    }

    private int parseCount(Token token) {
        int value = parseInteger(token);
        if (value < 0) {
            throw errorAt(ErrorKind.MALFORMED_LINE, token, "Conteggio negativo nella riga problema: " + value);
        }
        return value;
    }

    /**
     * Blocco di quantificatori: ogni variabile deve essere positiva, dichiarata e mai
     * quantificata in precedenza.
     */
    @Override
    public Void visitQuantifierLine(QuantifierLineContext ctx) {
        Quantifier quantifier = Quantifier.fromSymbol(ctx.quantifier.getText());
        List<TerminalNode> numbers = ctx.NUMBER();
        requireTerminator(ctx.terminator, numbers.get(numbers.size() - 1).getSymbol(), "blocco di quantificatori");

        List<Integer> variables = new ArrayList<>();
        for (TerminalNode node : numbers) {
            int variable = parseVariable(node.getSymbol());
            if (variable < 0) {
                throw errorAt(ErrorKind.UNDECLARED_VARIABLE, node.getSymbol(),
                        "Variabile quantificata negativa: " + variable);
            }
            requireDeclared(variable, node.getSymbol());
            if (!quantifiedVariables.add(variable)) {
                throw errorAt(ErrorKind.DUPLICATE_QUANTIFICATION, node.getSymbol(),
                        "Variabile " + variable + " già quantificata");
            }
            variables.add(variable);
        }

        quantifierBlocks.add(new QuantifierBlock(quantifier, variables));
        return null;
    }

    @Override
    public Void visitClauseLine(ClauseLineContext ctx) {
        List<TerminalNode> numbers = ctx.NUMBER();
        if (!numbers.isEmpty()) {
            requireTerminator(ctx.terminator, numbers.get(numbers.size() - 1).getSymbol(), "clausola");
        }

        List<Integer> literals = new ArrayList<>(numbers.size());
        for (TerminalNode node : numbers) {
            int literal = parseVariable(node.getSymbol());
            requireDeclared(Math.abs(literal), node.getSymbol());
            literals.add(literal);
        }

        clauses.add(new Clause(literals));
        return null;
    }

    //endregion

    //region VALIDAZIONE

    private void requireTerminator(Token terminator, Token lastToken, String lineKind) {
        if (terminator == null) {
            int column = lastToken.getCharPositionInLine() + lastToken.getText().length();
            throw new FormulaException(ErrorKind.STRUCTURAL_MISMATCH,
                    "Terminatore 0 mancante al termine della riga di " + lineKind, lastToken.getLine(), column);
        }
    }

    private void requireDeclared(int variable, Token token) {
        // Math.abs(Integer.MIN_VALUE) resta negativo
        if (variable <= 0 || variable > header.variableCount()) {
            throw errorAt(ErrorKind.UNDECLARED_VARIABLE, token,
                    "Variabile " + variable + " non dichiarata (limite " + header.variableCount() + ")");
        }
    }

    private int parseInteger(TerminalNode node) {
        return parseInteger(node.getSymbol());
    }

    private int parseInteger(Token token) {
        try {
            return Integer.parseInt(token.getText());
        } catch (NumberFormatException e) {
            throw errorAt(ErrorKind.MALFORMED_LINE, token, "Intero non rappresentabile: " + token.getText());
        }
    }

    /**
     * Identificatore di variabile o letterale: un valore fuori dal range di int supera
     * sicuramente il limite dichiarato nella riga problema.
     */
    private int parseVariable(Token token) {
        try {
            return Integer.parseInt(token.getText());
        } catch (NumberFormatException e) {
            throw errorAt(ErrorKind.UNDECLARED_VARIABLE, token,
                    "Variabile " + token.getText() + " oltre il limite dichiarato " + header.variableCount());
        }
    }

    private static FormulaException errorAt(ErrorKind kind, Token token, String message) {
        return new FormulaException(kind, message, token.getLine(), token.getCharPositionInLine());
    }

    //endregion
}
