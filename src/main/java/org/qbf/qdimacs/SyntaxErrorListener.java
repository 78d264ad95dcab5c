package org.qbf.qdimacs;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.qbf.support.ErrorKind;
import org.qbf.support.FormulaException;

/**
 * Converte il primo errore sintattico segnalato da lexer o parser ANTLR in una
 * {@link FormulaException} con riga e colonna. Un errore sul token di fine input
 * indica un documento troncato ed è classificato come STRUCTURAL_MISMATCH.
 */
class SyntaxErrorListener extends BaseErrorListener {

    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        if (offendingSymbol instanceof Token token && token.getType() == Token.EOF) {
            throw new FormulaException(ErrorKind.STRUCTURAL_MISMATCH,
                    "Fine input prematura: " + msg, line, charPositionInLine);
        }
        throw new FormulaException(ErrorKind.MALFORMED_LINE, msg, line, charPositionInLine);
    }
}
