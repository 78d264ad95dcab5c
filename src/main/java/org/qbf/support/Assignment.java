package org.qbf.support;

import java.util.*;

/**
 * ASSEGNAMENTO PARZIALE - Funzione parziale variabile → valore booleano
 *
 * L'ordine di inserimento coincide con l'ordine del prefisso: il dominio è sempre un
 * prefisso contiguo delle variabili quantificate, fissate dallo split una dopo l'altra.
 * Istanze immutabili, condivisibili in sola lettura tra simplificatore e riscrittore.
 */
public final class Assignment {

    private final Map<Integer, Boolean> values;

    private Assignment(Map<Integer, Boolean> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * @return assegnamento vuoto (nessuna variabile fissata)
     */
    public static Assignment empty() {
        return new Assignment(new LinkedHashMap<>());
    }

    /**
     * Costruisce l'assegnamento codificato da un indice di split.
     *
     * L'indice è letto in binario su variables.size() bit: la prima variabile corrisponde
     * al bit più significativo, bit 0 = falso e bit 1 = vero.
     *
     * @param variables variabili fissate, nell'ordine del prefisso
     * @param index indice in [0, 2^variables.size())
     * @return assegnamento corrispondente
     */
    public static Assignment fromIndex(List<Integer> variables, int index) {
        int depth = variables.size();
        if (depth > 30) {
            throw new IllegalArgumentException("Troppe variabili per un indice intero: " + depth);
        }
        if (index < 0 || index >= (1 << depth)) {
            throw new IllegalArgumentException("Indice " + index + " fuori da [0, 2^" + depth + ")");
        }

        Map<Integer, Boolean> values = new LinkedHashMap<>();
        for (int position = 0; position < depth; position++) {
            int bit = (index >> (depth - 1 - position)) & 1;
            Boolean previous = values.put(variables.get(position), bit == 1);
            if (previous != null) {
                throw new IllegalArgumentException("Variabile ripetuta nell'assegnamento: " + variables.get(position));
            }
        }
        return new Assignment(values);
    }

    public boolean isAssigned(int variable) {
        return values.containsKey(variable);
    }

    /**
     * @return valore della variabile, oppure null se non assegnata
     */
    public Boolean valueOf(int variable) {
        return values.get(variable);
    }

    /**
     * Valuta un letterale DIMACS sotto l'assegnamento.
     *
     * @param literal letterale con segno
     * @return TRUE/FALSE se la variabile è assegnata, null altrimenti
     */
    public Boolean evaluate(int literal) {
        Boolean value = values.get(Math.abs(literal));
        if (value == null) {
            return null;
        }
        return literal > 0 ? value : !value;
    }

    /**
     * @return variabili assegnate nell'ordine del prefisso
     */
    public List<Integer> getVariables() {
        return List.copyOf(values.keySet());
    }

    /**
     * @return letterali veri sotto l'assegnamento, uno per variabile, nell'ordine del prefisso
     */
    public List<Integer> getTrueLiterals() {
        List<Integer> literals = new ArrayList<>(values.size());
        for (Map.Entry<Integer, Boolean> entry : values.entrySet()) {
            literals.add(entry.getValue() ? entry.getKey() : -entry.getKey());
        }
        return literals;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Pattern leggibile dell'assegnamento: un carattere per variabile, 't' vero e 'f' falso.
     * Usato per i nomi dei file prodotti dallo split.
     */
    public String toPattern() {
        StringBuilder pattern = new StringBuilder(values.size());
        for (Boolean value : values.values()) {
            pattern.append(value ? 't' : 'f');
        }
        return pattern.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Assignment that)) {
            return false;
        }
        // L'ordine fa parte dell'identità dell'assegnamento
        return getTrueLiterals().equals(that.getTrueLiterals());
    }

    @Override
    public int hashCode() {
        return getTrueLiterals().hashCode();
    }

    @Override
    public String toString() {
        return "Assignment" + values;
    }
}
