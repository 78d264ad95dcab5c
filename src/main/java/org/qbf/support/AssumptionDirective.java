package org.qbf.support;

import java.util.List;

/**
 * DIRETTIVA DI ASSUNZIONE INTERA - riga "cs int ..." oppure "s int ..." del preambolo
 *
 * Contiene uno o più vincoli concatenati con ';'. Le direttive non vengono interpretate
 * durante lo split: sono metadati trasportati invariati in ogni formula derivata.
 *
 * @param marker prefisso normalizzato della riga ("cs int" oppure "s int")
 * @param constraints vincoli nell'ordine in cui compaiono, almeno uno
 */
public record AssumptionDirective(String marker, List<IntegerConstraint> constraints) {

    public static final String COMMENT_MARKER = "cs int";
    public static final String PLAIN_MARKER = "s int";

    public AssumptionDirective {
        if (!COMMENT_MARKER.equals(marker) && !PLAIN_MARKER.equals(marker)) {
            throw new IllegalArgumentException("Prefisso direttiva non valido: '" + marker + "'");
        }
        if (constraints == null || constraints.isEmpty()) {
            throw new IllegalArgumentException("Una direttiva richiede almeno un vincolo");
        }
        constraints = List.copyOf(constraints);
    }

    /**
     * Normalizza il testo del token di apertura (spazi multipli, tabulazioni) in uno dei due prefissi.
     */
    public static String normalizeMarker(String rawMarker) {
        return rawMarker.trim().startsWith("cs") ? COMMENT_MARKER : PLAIN_MARKER;
    }

    /**
     * @return riga testuale della direttiva
     */
    @Override
    public String toString() {
        StringBuilder line = new StringBuilder(marker);
        for (int i = 0; i < constraints.size(); i++) {
            line.append(i == 0 ? " " : " ; ").append(constraints.get(i));
        }
        return line.toString();
    }
}
