package org.qbf.qdimacs;

import org.qbf.support.AssumptionDirective;
import org.qbf.support.Clause;
import org.qbf.support.Formula;
import org.qbf.support.ProblemHeader;
import org.qbf.support.QuantifierBlock;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * SERIALIZZATORE QDIMACS ESTESO
 *
 * Scrive una {@link Formula} nel formato testuale letto da {@link QdimacsFormulaParser}:
 * commenti di provenienza opzionali, direttive intere, riga problema, blocchi e clausole.
 *
 * La riga problema non è copiata dall'input ma ricalcolata sul contenuto emesso:
 * - variabili: identificatore più alto usato da prefisso, clausole e operandi delle direttive
 * - clausole: numero di clausole scritte
 *
 * La clausola vuota è emessa come riga "0".
 */
public class QdimacsWriter {

    private static final Logger LOGGER = Logger.getLogger(QdimacsWriter.class.getName());

    private static final String COMMENT_PREFIX = "c ";
    private static final String LINE_SEPARATOR = "\n";

    /** Righe di commento scritte in testa al documento, senza il prefisso "c " */
    private final List<String> comments = new ArrayList<>();

    /**
     * Aggiunge un commento di provenienza emesso prima delle direttive.
     * I caratteri non ASCII (ad esempio in un nome di file) sono sostituiti da '?'
     * perché il documento è scritto in US-ASCII.
     *
     * @param comment testo del commento su una sola riga
     * @return questo writer
     */
    public QdimacsWriter withComment(String comment) {
        if (comment == null || comment.contains("\n") || comment.contains("\r")) {
            throw new IllegalArgumentException("Commento non valido: deve essere una singola riga");
        }
        comments.add(toAscii(comment));
        return this;
    }

    static String toAscii(String text) {
        StringBuilder ascii = new StringBuilder(text.length());
        text.codePoints().forEach(c -> ascii.append(c >= 0x20 && c < 0x7F ? (char) c : '?'));
        return ascii.toString();
    }

    /**
     * @return testo completo della formula
     */
    public String emit(Formula formula) {
        StringWriter buffer = new StringWriter();
        try {
            write(formula, buffer);
        } catch (IOException e) {
            // StringWriter non solleva IOException
            throw new UncheckedIOException(e);
        }
        return buffer.toString();
    }

    /**
     * Scrive la formula su file, creando le directory mancanti.
     *
     * @throws IOException se il file non è scrivibile
     */
    public void write(Formula formula, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.US_ASCII)) {
            write(formula, writer);
        }
        LOGGER.fine("Formula scritta in " + target);
    }

    /**
     * Scrive la formula sul writer fornito, senza chiuderlo.
     */
    public void write(Formula formula, Writer writer) throws IOException {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }

        for (String comment : comments) {
            writer.write(COMMENT_PREFIX + comment + LINE_SEPARATOR);
        }
        for (AssumptionDirective directive : formula.getDirectives()) {
            writer.write(directive + LINE_SEPARATOR);
        }

        ProblemHeader header = recomputeHeader(formula);
        writer.write(header + LINE_SEPARATOR);

        for (QuantifierBlock block : formula.getQuantifierBlocks()) {
            writer.write(block + LINE_SEPARATOR);
        }
        for (Clause clause : formula.getClauses()) {
            writer.write(clause + LINE_SEPARATOR);
        }
        writer.flush();
    }

    /**
     * Riga problema coerente con il contenuto effettivamente emesso.
     */
    static ProblemHeader recomputeHeader(Formula formula) {
        return new ProblemHeader(formula.getMaxVariable(), formula.getClauses().size());
    }
}
