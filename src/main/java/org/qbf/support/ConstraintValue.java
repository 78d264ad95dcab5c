package org.qbf.support;

/**
 * LATO DESTRO DI UN VINCOLO INTERO
 *
 * Può essere un intero con segno oppure un pattern di bit esplicito
 * (sequenza di caratteri 0/1, bit più significativo per primo, scritto tra graffe).
 * Esattamente una delle due forme è presente: bitPattern null indica la forma intera.
 *
 * @param integer valore intero (significativo solo se bitPattern è null)
 * @param bitPattern pattern di bit senza graffe, oppure null
 */
public record ConstraintValue(long integer, String bitPattern) {

    public ConstraintValue {
        if (bitPattern != null && !bitPattern.matches("[01]+")) {
            throw new IllegalArgumentException("Pattern di bit non valido: '" + bitPattern + "'");
        }
    }

    public static ConstraintValue ofInteger(long value) {
        return new ConstraintValue(value, null);
    }

    public static ConstraintValue ofBitPattern(String bits) {
        if (bits == null) {
            throw new IllegalArgumentException("Pattern di bit non può essere null");
        }
        return new ConstraintValue(0L, bits);
    }

    public boolean isBitPattern() {
        return bitPattern != null;
    }

    /**
     * @return bit del pattern come array di 0/1, bit più significativo in posizione 0
     * @throws IllegalStateException se il valore è in forma intera
     */
    public int[] bits() {
        if (bitPattern == null) {
            throw new IllegalStateException("Il valore " + integer + " non è un pattern di bit");
        }
        int[] bits = new int[bitPattern.length()];
        for (int i = 0; i < bits.length; i++) {
            bits[i] = bitPattern.charAt(i) == '1' ? 1 : 0;
        }
        return bits;
    }

    @Override
    public String toString() {
        return bitPattern != null ? "{" + bitPattern + "}" : Long.toString(integer);
    }
}
