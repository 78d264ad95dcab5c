package org.qbf.support;

/**
 * Errore locale e sincrono del parsing o dello split di una formula.
 *
 * Trasporta la categoria dell'errore e, per gli errori di parsing, la posizione
 * (riga a partire da 1, colonna a partire da 0). Per gli errori senza posizione
 * entrambi i valori sono -1.
 */
public class FormulaException extends RuntimeException {

    private final ErrorKind kind;
    private final int line;
    private final int column;

    public FormulaException(ErrorKind kind, String message) {
        this(kind, message, -1, -1);
    }

    public FormulaException(ErrorKind kind, String message, int line, int column) {
        super(formatMessage(kind, message, line, column));
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    private static String formatMessage(ErrorKind kind, String message, int line, int column) {
        if (line < 0) {
            return kind + ": " + message;
        }
        return kind + " [riga " + line + ", colonna " + column + "]: " + message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasPosition() {
        return line >= 0;
    }
}
