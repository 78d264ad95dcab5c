package org.qbf;

import org.qbf.merge.MergeFormulaBuilder;
import org.qbf.qdimacs.QdimacsFormulaParser;
import org.qbf.qdimacs.QdimacsWriter;
import org.qbf.split.FormulaSplitter;
import org.qbf.split.SplitResult;
import org.qbf.support.Formula;
import org.qbf.support.FormulaException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * SPLITTER QDIMACS - Divisione di formule QBF sul prefisso dei quantificatori
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula in formato QDIMACS esteso (blocchi, clausole, direttive intere)
 * 2. PARSING: Grammatica ANTLR e costruzione del modello strutturale
 * 3. SPLIT: Enumerazione dei 2^d assegnamenti delle prime d variabili del prefisso
 * 4. SEMPLIFICAZIONE: Sostituzione delle costanti nelle clausole e riscrittura del prefisso
 * 5. OUTPUT: Un file QDIMACS per ramo, più la formula di merge opzionale
 *
 * NOMI DEI FILE GENERATI:
 * - <pattern>_<file input>: un carattere per variabile fissata, 'f' falso e 't' vero
 * - identity_<file input>: split a profondità 0
 * - merge_<file input>: formula di merge con selettori (opzione -m)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DEPTH_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String MERGE_PARAM = "-m";
    private static final String THREADS_PARAM = "-j";
    private static final String VERBOSE_PARAM = "-v";

    private static final int DEFAULT_DEPTH = 4;
    private static final int DEFAULT_THREADS = 1;

    private static final String IDENTITY_PREFIX = "identity";
    private static final String MERGE_PREFIX = "merge";

    /** Configurazione di logging caricata dal classpath all'avvio */
    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    /** Logger radice dell'applicazione, trattenuto perché il livello impostato con -v non vada perso */
    private static final Logger APPLICATION_LOGGER = Logger.getLogger("org.qbf");

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != EXIT_SUCCESS) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue lo splitter e restituisce il codice di uscita.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Configurazione del logging
     * 3. Lettura della formula, split e scrittura dei rami
     * 4. Gestione errori con messaggio per l'utente
     *
     * @param args parametri linea di comando forniti dall'utente
     * @return 0 in caso di successo, 1 in caso di errore
     */
    static int run(String[] args) {
        if (args.length == 0) {
            System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_FAILURE;
        }

        SplitterConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return EXIT_FAILURE;
        }
        if (config == null) {
            return EXIT_SUCCESS; // Help mostrato
        }

        configureLogging(config.verbose);
        displayConfigurationSummary(config);

        try {
            executeSplitPipeline(config);
            return EXIT_SUCCESS;
        } catch (FormulaException e) {
            System.out.println("[E] Formula non valida: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | UncheckedIOException e) {
            LOGGER.log(Level.SEVERE, "Errore di I/O durante lo split", e);
            System.out.println("[E] Errore di I/O: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            System.out.println("[E] " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    //endregion

    //region PIPELINE DI SPLIT

    /**
     * Legge la formula, la divide e scrive un file per ramo.
     *
     * Senza formula di merge i rami vengono scritti e rilasciati uno alla volta;
     * con la formula di merge vengono trattenuti fino alla sua costruzione.
     */
    private static void executeSplitPipeline(SplitterConfiguration config) throws IOException {
        Path inputPath = Paths.get(config.inputPath);
        Formula formula = new QdimacsFormulaParser().parse(inputPath);
        System.out.println("[I] Formula letta: " + formula.getPrefix().size() + " variabili nel prefisso, "
                + formula.getClauses().size() + " clausole");

        Path outputDir = getOutputDirectory(config);
        String fileName = inputPath.getFileName().toString();
        FormulaSplitter splitter = new FormulaSplitter();
        SplitStatistics statistics = new SplitStatistics();

        Consumer<SplitResult> branchWriter = result -> {
            writeBranch(result, outputDir, fileName);
            statistics.record(result);
        };

        if (config.writeMerge) {
            // La formula di merge è costruita prima di scrivere i rami: se non è costruibile
            // nessun file viene lasciato su disco
            List<SplitResult> results = splitter.splitInParallel(formula, config.depth, config.threads);
            Formula merged = new MergeFormulaBuilder().build(results);
            results.forEach(branchWriter);
            writeMergeFormula(merged, results.size(), outputDir, fileName);
        } else {
            splitter.forEachSplitInParallel(formula, config.depth, config.threads, branchWriter);
        }

        displaySplitSummary(statistics, outputDir);
    }

    private static void writeBranch(SplitResult result, Path outputDir, String fileName) {
        Path target = outputDir.resolve(branchFileName(result, fileName));
        try {
            new QdimacsWriter()
                    .withComment("ramo " + result.index() + " (" + describePattern(result) + ") di " + fileName)
                    .write(result.formula(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Scrittura del ramo " + result.index() + " fallita: " + target, e);
        }
    }

    private static void writeMergeFormula(Formula merged, int branches, Path outputDir, String fileName) throws IOException {
        Path target = outputDir.resolve(MERGE_PREFIX + "_" + fileName);
        new QdimacsWriter()
                .withComment("formula di merge di " + branches + " rami di " + fileName)
                .write(merged, target);
        System.out.println("[I] Formula di merge scritta: " + target);
    }

    /**
     * Nome del file di un ramo: pattern dell'assegnamento seguito dal nome del file di input.
     */
    static String branchFileName(SplitResult result, String fileName) {
        String pattern = result.pattern();
        return (pattern.isEmpty() ? IDENTITY_PREFIX : pattern) + "_" + fileName;
    }

    private static String describePattern(SplitResult result) {
        return result.pattern().isEmpty() ? IDENTITY_PREFIX : result.pattern();
    }

    //endregion

    //region OUTPUT E LOGGING

    /**
     * Carica la configurazione di logging dal classpath; con -v il livello scende a FINE.
     */
    private static void configureLogging(boolean verbose) {
        try (InputStream configuration = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (configuration != null) {
                LogManager.getLogManager().readConfiguration(configuration);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione di logging non leggibile: " + e.getMessage());
        }

        if (verbose) {
            // logging.properties fissa il livello di org.qbf: va abbassato esplicitamente
            APPLICATION_LOGGER.setLevel(Level.FINE);
            Logger root = Logger.getLogger("");
            root.setLevel(Level.FINE);
            for (Handler handler : root.getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    private static void displayConfigurationSummary(SplitterConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE SPLITTER QDIMACS <<--");
        System.out.println("Input: " + config.inputPath);
        System.out.println("Profondità: " + config.depth);
        System.out.println("Thread: " + config.threads);
        System.out.println("Formula di merge: " + (config.writeMerge ? "Sì" : "No"));
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("====================================\n");
    }

    private static void displaySplitSummary(SplitStatistics statistics, Path outputDir) {
        System.out.println("\n-->> RIEPILOGO SPLIT <<--");
        System.out.println("Rami scritti: " + statistics.branches);
        System.out.println("Rami con clausola vuota: " + statistics.unsatisfiableBranches);
        System.out.println("Rami senza clausole: " + statistics.emptyMatrixBranches);
        System.out.println("Directory output: " + outputDir.toAbsolutePath());
    }

    private static Path getOutputDirectory(SplitterConfiguration config) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath);
        }
        Path parentDir = Paths.get(config.inputPath).toAbsolutePath().getParent();
        return parentDir != null ? parentDir : Paths.get(".");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> SPLITTER QDIMACS <<::");
        System.out.println("Divide una formula QBF sulle prime variabili del prefisso dei quantificatori\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar qdimacs-splitter.jar -f <file> [opzioni]\n");

        System.out.println("PARAMETRI:");
        System.out.println("  -f <file>       Formula di input in formato QDIMACS esteso (obbligatorio)");
        System.out.println("  -d <profondità> Numero di variabili del prefisso da fissare (default: " + DEFAULT_DEPTH + ")");
        System.out.println("  -o <directory>  Directory di output (default: stessa dell'input)");
        System.out.println("  -m              Scrive anche la formula di merge con selettori");
        System.out.println("  -j <thread>     Thread per il calcolo dei rami (default: " + DEFAULT_THREADS + ")");
        System.out.println("  -v              Logging dettagliato");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar qdimacs-splitter.jar -f formula.qdimacs -d 3");
        System.out.println("  java -jar qdimacs-splitter.jar -f formula.qdimacs -d 2 -m -o ./rami/ -j 4\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Un file per ramo: <pattern>_<file>, pattern con 'f'/'t' per ogni variabile fissata");
        System.out.println("  - La profondità non può superare le variabili del prefisso");
        System.out.println("  - La formula di merge richiede che le variabili fissate siano esistenziali\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class SplitterConfiguration {
        final String inputPath;
        final String outputPath;
        final int depth;
        final int threads;
        final boolean writeMerge;
        final boolean verbose;

        SplitterConfiguration(String inputPath, String outputPath, int depth, int threads,
                              boolean writeMerge, boolean verbose) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.depth = depth;
            this.threads = threads;
            this.writeMerge = writeMerge;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri della linea di comando con messaggi di errore per l'utente.
     */
    private static class ArgumentParser {

        /**
         * @param args parametri da linea comando
         * @return configurazione validata, oppure null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        SplitterConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            int depth = DEFAULT_DEPTH;
            int threads = DEFAULT_THREADS;
            boolean writeMerge = false;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }
                    case DEPTH_PARAM -> depth = parseNonNegative(getNextArgument(args, ++i, "profondità"), "profondità");
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case THREADS_PARAM -> {
                        threads = parseNonNegative(getNextArgument(args, ++i, "numero thread"), "numero thread");
                        if (threads < 1) {
                            throw new IllegalArgumentException("Numero thread deve essere almeno 1");
                        }
                    }
                    case MERGE_PARAM -> writeMerge = true;
                    case VERBOSE_PARAM -> verbose = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare la formula di input con -f");
            }
            return new SplitterConfiguration(inputPath, outputPath, depth, threads, writeMerge, verbose);
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseNonNegative(String value, String argumentType) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < 0) {
                    throw new IllegalArgumentException("Valore negativo per " + argumentType + ": " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + argumentType + ": " + value);
            }
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    /**
     * Conteggi raccolti durante la scrittura dei rami.
     */
    private static class SplitStatistics {
        int branches = 0;
        int unsatisfiableBranches = 0;
        int emptyMatrixBranches = 0;

        void record(SplitResult result) {
            branches++;
            if (result.formula().containsEmptyClause()) unsatisfiableBranches++;
            if (result.formula().getClauses().isEmpty()) emptyMatrixBranches++;
        }
    }

    //endregion
}
