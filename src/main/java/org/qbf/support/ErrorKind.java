package org.qbf.support;

/**
 * Categorie di errore riportate da parsing e split.
 */
public enum ErrorKind {
    MALFORMED_LINE,             // Riga che non corrisponde alla forma attesa nella sua posizione
    UNDECLARED_VARIABLE,        // Identificatore 0, negativo dove non ammesso, o oltre il limite dichiarato
    DUPLICATE_QUANTIFICATION,   // Variabile presente in più di un blocco di quantificatori
    DEPTH_OUT_OF_RANGE,         // Profondità di split oltre le variabili del prefisso
    STRUCTURAL_MISMATCH         // Terminatore 0 mancante o fine input prematura
}
