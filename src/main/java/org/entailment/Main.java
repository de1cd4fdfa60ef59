package org.entailment;

import org.entailment.engine.EntailmentChecker;
import org.entailment.engine.EntailmentResult;
import org.entailment.engine.SatisfiabilityReport;
import org.entailment.formula.AtomCollector;
import org.entailment.formula.Formula;
import org.entailment.parser.FormulaLexer;
import org.entailment.parser.FormulaParser;
import org.entailment.parser.FormulaSyntaxException;
import org.entailment.parser.FormulaToken;
import org.entailment.parser.IffPolicy;
import org.entailment.parser.KnowledgeBaseReader;
import org.entailment.support.Assignment;
import org.entailment.support.AssignmentEnumerator;
import org.entailment.support.ResourceLimitExceededException;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * VERIFICATORE DI CONSEGUENZA LOGICA PROPOSIZIONALE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula (o base di conoscenza + formula obiettivo) da file, directory o standard input
 * 2. LEXING: Testo -> sequenza di token (atomi, connettivi, parentesi)
 * 3. PARSING: Token -> albero della formula (grammatica ANTLR, discesa ricorsiva)
 * 4. ATOMI: Raccolta degli atomi distinti e ordinamento alfabetico
 * 5. ENUMERAZIONE: Valutazione della formula su tutti i 2^n assegnamenti
 * 6. OUTPUT: Assegnamenti soddisfacenti/falsificanti oppure verdetto KB ⊨ α con controesempio
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): formula sulla prima riga non vuota del file
 * - Conseguenza logica (-e): riga 1 base di conoscenza separata da virgole, riga 2 formula obiettivo
 * - Directory batch (-d): tutti i file .txt (formula) e .kb (conseguenza logica)
 * - Standard input (-i, -i=entail)
 * - Limite atomi configurabile (-max=n) e interpretazione storica di iff (-iff=legacy)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - RESULT/: report testuale per ogni file elaborato
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    static final String HELP_PARAM = "-h";
    static final String FILE_PARAM = "-f";
    static final String ENTAIL_PARAM = "-e";
    static final String DIR_PARAM = "-d";
    static final String OUTPUT_PARAM = "-o";
    static final String INTERACTIVE_PARAM = "-i";
    static final String INTERACTIVE_ENTAIL_PARAM = "-i=entail";
    static final String MAX_ATOMS_PARAM = "-max=";
    static final String IFF_PARAM = "-iff=";

    /**
     * Valori ammessi per -iff=
     * */
    private static final String IFF_LEGACY = "legacy";
    private static final String IFF_BICONDITIONAL = "biconditional";

    /**
     * Estensioni riconosciute in modalità directory
     * */
    private static final String FORMULA_EXTENSION = ".txt";
    private static final String KNOWLEDGE_BASE_EXTENSION = ".kb";

    private static final String RESULT_DIR = "RESULT";
    private static final String LOGGING_CONFIG = "/logging.properties";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del verificatore.
     *
     * FLUSSO ESECUZIONE:
     * 1. Configurazione del logging
     * 2. Parsing e validazione parametri linea di comando
     * 3. Esecuzione della modalità richiesta
     * 4. Gestione errori globali
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO VERIFICATORE CONSEGUENZA LOGICA <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            VerifierConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE VERIFICATORE <---");
        }
    }

    private static void executeMainPipeline(VerifierConfiguration config) {
        switch (config.mode) {
            case FORMULA_FILE -> {
                System.out.println("[I] Modalità: Analisi formula da file");
                processFormulaFile(config, new File(config.inputPath));
            }
            case ENTAILMENT_FILE -> {
                System.out.println("[I] Modalità: Conseguenza logica da file");
                processEntailmentFile(config, new File(config.inputPath));
            }
            case DIRECTORY -> {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }
            case INTERACTIVE_FORMULA -> processInteractiveFormula(config, System.in);
            case INTERACTIVE_ENTAILMENT -> processInteractiveEntailment(config, System.in);
        }
    }

    /**
     * Carica la configurazione di java.util.logging dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream stream = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (stream != null) {
                LogManager.getLogManager().readConfiguration(stream);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static VerifierConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(VerifierConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE VERIFICATORE <<--");
        System.out.println("Modalità: " + config.mode.description);
        if (config.inputPath != null) {
            System.out.println("Input: " + config.inputPath);
        }
        System.out.println("Limite atomi: " + config.maxAtoms);
        System.out.println("Interpretazione iff: " + (config.iffPolicy == IffPolicy.BICONDITIONAL
                ? "biimplicazione" : "implicazione (storica)"));
        if (!config.mode.interactive) {
            System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        }
        System.out.println("====================================\n");
    }

    //endregion

    //region ELABORAZIONE FORMULA

    /**
     * Analizza la formula contenuta in un file e salva il report in RESULT/.
     *
     * @return true se l'elaborazione è riuscita
     */
    private static boolean processFormulaFile(VerifierConfiguration config, File file) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + file.getName());
        System.out.println("=========================\n");

        try {
            String formulaText = readFirstNonBlankLine(file.toPath());
            String report = buildFormulaReport(formulaText, config);
            System.out.println(report);
            saveReport(report, config, file.getPath());
            return true;
        } catch (FormulaSyntaxException | ResourceLimitExceededException | IllegalArgumentException e) {
            handleInputError(file.getPath(), e);
        } catch (IOException e) {
            handleFileProcessingError(file.getPath(), e);
        }
        return false;
    }

    /**
     * Pipeline completa su una singola formula: token, albero, atomi, partizione degli assegnamenti.
     *
     * @throws FormulaSyntaxException se la formula non è sintatticamente valida
     * @throws ResourceLimitExceededException se gli atomi superano il limite configurato
     */
    static String buildFormulaReport(String formulaText, VerifierConfiguration config) {
        List<FormulaToken> tokens = FormulaLexer.lex(formulaText);
        Formula formula = new FormulaParser(tokens, config.iffPolicy).parse();
        Set<String> atoms = AtomCollector.collect(formula);

        EntailmentChecker checker = new EntailmentChecker(new AssignmentEnumerator(config.maxAtoms));
        SatisfiabilityReport report = checker.satisfiability(formula);

        StringBuilder out = new StringBuilder();
        out.append("Formula: ").append(formulaText.trim()).append('\n');
        out.append("Token: ").append(tokens).append('\n');
        out.append("Albero: ").append(formula).append('\n');
        out.append("Atomi: ").append(atoms).append("\n\n");

        out.append("RISULTATO: ").append(describeSatisfiability(report)).append("\n\n");

        out.append("Assegnamenti soddisfacenti (").append(report.getSatisfyingAssignments().size()).append("):\n");
        appendAssignments(out, report.getSatisfyingAssignments());
        out.append("Assegnamenti falsificanti (").append(report.getFalsifyingAssignments().size()).append("):\n");
        appendAssignments(out, report.getFalsifyingAssignments());

        out.append("\n=== STATISTICHE ===\n");
        out.append(report.getStatistics()).append('\n');
        return out.toString();
    }

    private static String describeSatisfiability(SatisfiabilityReport report) {
        if (report.isValid()) {
            return "VALIDA (tautologia)";
        }
        return report.isSatisfiable() ? "SODDISFACIBILE" : "INSODDISFACIBILE";
    }

    private static void appendAssignments(StringBuilder out, List<Assignment> assignments) {
        if (assignments.isEmpty()) {
            out.append("  (nessuno)\n");
            return;
        }
        for (Assignment assignment : assignments) {
            out.append("  ").append(assignment).append('\n');
        }
    }

    //endregion

    //region ELABORAZIONE CONSEGUENZA LOGICA

    private static boolean processEntailmentFile(VerifierConfiguration config, File file) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + file.getName());
        System.out.println("=========================\n");

        try {
            List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
            if (lines.size() < 2) {
                throw new IllegalArgumentException("File di conseguenza logica incompleto: attese 2 righe "
                        + "(base di conoscenza, formula obiettivo), trovate " + lines.size());
            }
            String report = buildEntailmentReport(lines.get(0), lines.get(1), config);
            System.out.println(report);
            saveReport(report, config, file.getPath());
            return true;
        } catch (FormulaSyntaxException | ResourceLimitExceededException | IllegalArgumentException e) {
            handleInputError(file.getPath(), e);
        } catch (IOException e) {
            handleFileProcessingError(file.getPath(), e);
        }
        return false;
    }

    /**
     * Verifica KB ⊨ α e produce il report con verdetto e controesempio.
     *
     * @param knowledgeBaseLine formule della base di conoscenza separate da virgole (può essere vuota)
     * @param queryText formula obiettivo α
     * @throws FormulaSyntaxException se una delle formule non è valida
     * @throws ResourceLimitExceededException se gli atomi superano il limite configurato
     */
    static String buildEntailmentReport(String knowledgeBaseLine, String queryText, VerifierConfiguration config) {
        List<Formula> knowledgeBase = new KnowledgeBaseReader(config.iffPolicy).read(knowledgeBaseLine);
        Formula query = FormulaParser.parseFormula(queryText, config.iffPolicy);

        EntailmentChecker checker = new EntailmentChecker(new AssignmentEnumerator(config.maxAtoms));
        EntailmentResult result = checker.entails(knowledgeBase, query);

        StringBuilder out = new StringBuilder();
        out.append("Base di conoscenza (").append(knowledgeBase.size()).append(" formule):\n");
        for (Formula formula : knowledgeBase) {
            out.append("  ").append(formula.toInfix()).append('\n');
        }
        out.append("Formula obiettivo: ").append(query.toInfix()).append("\n\n");

        out.append("KB ⊨ α: ").append(result.isEntailed()).append('\n');
        result.getCounterModel().ifPresent(counterModel ->
                out.append("Controesempio: ").append(counterModel).append('\n'));
        out.append("Modelli della base di conoscenza: ").append(result.getKnowledgeBaseModels()).append('\n');

        out.append("\n=== STATISTICHE ===\n");
        out.append(result.getStatistics()).append('\n');
        return out.toString();
    }

    //endregion

    //region STANDARD INPUT

    static void processInteractiveFormula(VerifierConfiguration config, InputStream input) {
        System.out.println("Inserire una formula logica:");
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null) {
                System.out.println("[W] Nessuna formula letta dallo standard input.");
                return;
            }
            System.out.println(buildFormulaReport(line, config));
        } catch (FormulaSyntaxException | ResourceLimitExceededException e) {
            handleInputError("standard input", e);
        } catch (IOException e) {
            handleFileProcessingError("standard input", e);
        }
    }

    static void processInteractiveEntailment(VerifierConfiguration config, InputStream input) {
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
            System.out.println("Inserire la base di conoscenza (formule separate da virgole):");
            String knowledgeBaseLine = reader.readLine();
            System.out.println("Inserire la formula obiettivo:");
            String queryLine = reader.readLine();
            if (knowledgeBaseLine == null || queryLine == null) {
                System.out.println("[W] Input incompleto: servono base di conoscenza e formula obiettivo.");
                return;
            }
            System.out.println(buildEntailmentReport(knowledgeBaseLine, queryLine, config));
        } catch (FormulaSyntaxException | ResourceLimitExceededException e) {
            handleInputError("standard input", e);
        } catch (IOException e) {
            handleFileProcessingError("standard input", e);
        }
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Elabora tutti i file .txt e .kb della directory in ordine di nome.
     *
     * Gli errori su singoli file non interrompono l'elaborazione degli altri.
     */
    private static void processDirectoryBatch(VerifierConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        try {
            List<File> files = findInputFiles(config.inputPath);
            if (files.isEmpty()) {
                System.out.println("[W] Nessun file .txt o .kb trovato nella directory specificata.");
                return;
            }

            BatchResult result = new BatchResult(files.size());
            for (File file : files) {
                System.out.println("Elaborazione: " + file.getName());
                boolean success = file.getName().toLowerCase().endsWith(KNOWLEDGE_BASE_EXTENSION)
                        ? processEntailmentFile(config, file)
                        : processFormulaFile(config, file);
                if (success) {
                    result.incrementSuccess();
                } else {
                    result.incrementError();
                }
                System.out.println(); // Separatore visivo
            }
            displayBatchSummary(result);

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    static List<File> findInputFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .txt e .kb nella directory...");

        List<File> files;
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            files = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.toString().toLowerCase();
                        return name.endsWith(FORMULA_EXTENSION) || name.endsWith(KNOWLEDGE_BASE_EXTENSION);
                    })
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();
        }

        System.out.println("Trovati " + files.size() + " file da elaborare.");
        return files;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File elaborati trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%\n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E DEGLI ERRORI

    private static String readFirstNonBlankLine(Path path) throws IOException {
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                return line;
            }
        }
        throw new IllegalArgumentException("Nessuna formula nel file: " + path.getFileName());
    }

    private static void saveReport(String report, VerifierConfiguration config, String inputPath) throws IOException {
        Path resultDir = getOutputDirectory(config, inputPath);
        Files.createDirectories(resultDir);

        Path resultFilePath = resultDir.resolve(getBaseFileName(inputPath) + ".result");
        try (FileWriter writer = new FileWriter(resultFilePath.toFile(), StandardCharsets.UTF_8)) {
            writer.write(report);
        }

        System.out.println("[I] Risultati salvati: " + resultFilePath);
    }

    /**
     * Errore dovuto al contenuto dell'input (sintassi, limite atomi, file malformato).
     */
    private static void handleInputError(String source, RuntimeException e) {
        LOGGER.log(Level.WARNING, "Input non valido in '" + source + "'", e);
        System.out.println("[E] Input non valido in '" + source + "': " + e.getMessage());
    }

    private static void handleFileProcessingError(String filePath, IOException e) {
        LOGGER.log(Level.SEVERE, "Errore di I/O su '" + filePath + "'", e);
        System.out.println("[E] Errore elaborazione del file '" + filePath + "': " + e.getMessage());
    }

    //endregion

    //region GESTIONE DEI PERCORSI

    /**
     * Directory RESULT/ sotto la directory di output, o accanto al file di input.
     */
    static Path getOutputDirectory(VerifierConfiguration config, String inputPath) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(RESULT_DIR);
        }
        Path parentDir = Paths.get(inputPath).getParent();
        return parentDir != null ? parentDir.resolve(RESULT_DIR) : Paths.get(RESULT_DIR);
    }

    static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> VERIFICATORE CONSEGUENZA LOGICA <<::");
        System.out.println("Soddisfacibilità e conseguenza logica proposizionale per enumerazione");
        System.out.println("esaustiva degli assegnamenti (tabella di verità)\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar verificatore-entailment.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  -f <file>       Analizza la formula sulla prima riga non vuota del file");
        System.out.println("  -e <file>       Conseguenza logica: riga 1 base di conoscenza, riga 2 formula obiettivo");
        System.out.println("  -d <directory>  Elabora tutti i file .txt (formula) e .kb (conseguenza logica)");
        System.out.println("  -i              Legge una formula dallo standard input");
        System.out.println("  -i=entail       Legge base di conoscenza e formula obiettivo dallo standard input\n");

        System.out.println("OPZIONI:");
        System.out.println("  -o <directory>  Directory di output per RESULT/ (default: stessa di input)");
        System.out.println("  -max=<n>        Numero massimo di atomi (1-" + AssignmentEnumerator.HARD_MAX_ATOMS
                + ", default " + AssignmentEnumerator.DEFAULT_MAX_ATOMS + ")");
        System.out.println("  -iff=legacy     Interpreta 'iff A then B' come implicazione");
        System.out.println("  -h              Mostra questo help\n");

        System.out.println("SINTASSI FORMULE:");
        System.out.println("  Atomi: sequenze di lettere (es. pioggia, a, B)");
        System.out.println("  Connettivi: not, and, or, if A then B, iff A then B, parentesi ( )");
        System.out.println("  and/or hanno la stessa precedenza e associano a sinistra\n");

        System.out.println("ESEMPI:");
        System.out.println("  java -jar verificatore-entailment.jar -f formula.txt");
        System.out.println("  java -jar verificatore-entailment.jar -e kb.kb -o risultati");
        System.out.println("  java -jar verificatore-entailment.jar -d formule/ -max=16");
        System.out.println("  echo \"if a then b\" | java -jar verificatore-entailment.jar -i\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    enum Mode {
        FORMULA_FILE("File singolo (formula)", false),
        ENTAILMENT_FILE("File singolo (conseguenza logica)", false),
        DIRECTORY("Directory", false),
        INTERACTIVE_FORMULA("Standard input (formula)", true),
        INTERACTIVE_ENTAILMENT("Standard input (conseguenza logica)", true);

        final String description;
        final boolean interactive;

        Mode(String description, boolean interactive) {
            this.description = description;
            this.interactive = interactive;
        }
    }

    /**
     * Configurazione validata dell'applicazione, immutabile durante l'elaborazione.
     */
    static class VerifierConfiguration {
        final Mode mode;
        final String inputPath;
        final String outputPath;
        final int maxAtoms;
        final IffPolicy iffPolicy;

        VerifierConfiguration(Mode mode, String inputPath, String outputPath, int maxAtoms, IffPolicy iffPolicy) {
            this.mode = mode;
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.maxAtoms = maxAtoms;
            this.iffPolicy = iffPolicy;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -f <file>, -e <file>, -d <dir>, -i, -i=entail: modalità (mutualmente esclusive)
         * -o <dir>: Directory output personalizzata
         * -max=<n>: Limite atomi
         * -iff=legacy|biconditional: Interpretazione di iff
         *
         * @param args parametri da linea comando
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        VerifierConfiguration parse(String[] args) {
            Mode mode = null;
            String inputPath = null;
            String outputPath = null;
            int maxAtoms = AssignmentEnumerator.DEFAULT_MAX_ATOMS;
            IffPolicy iffPolicy = IffPolicy.BICONDITIONAL;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(mode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        mode = Mode.FORMULA_FILE;
                    }
                    case ENTAIL_PARAM -> {
                        validateExclusiveMode(mode, "conseguenza logica");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        mode = Mode.ENTAILMENT_FILE;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(mode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        mode = Mode.DIRECTORY;
                    }
                    case INTERACTIVE_PARAM -> {
                        validateExclusiveMode(mode, "standard input");
                        mode = Mode.INTERACTIVE_FORMULA;
                    }
                    case INTERACTIVE_ENTAIL_PARAM -> {
                        validateExclusiveMode(mode, "standard input");
                        mode = Mode.INTERACTIVE_ENTAILMENT;
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    default -> {
                        if (args[i].startsWith(MAX_ATOMS_PARAM)) {
                            maxAtoms = parseMaxAtoms(args[i].substring(MAX_ATOMS_PARAM.length()));
                        } else if (args[i].startsWith(IFF_PARAM)) {
                            iffPolicy = parseIffPolicy(args[i].substring(IFF_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare input con -f, -e, -d oppure -i");
            }
            if (outputPath != null && mode.interactive) {
                throw new IllegalArgumentException("Parametro -o non disponibile in modalità standard input");
            }
            if (outputPath != null) {
                validateOrCreateOutputDirectory(outputPath);
            }
            return new VerifierConfiguration(mode, inputPath, outputPath, maxAtoms, iffPolicy);
        }

        private void validateExclusiveMode(Mode current, String requested) {
            if (current != null) {
                throw new IllegalArgumentException("Modalità " + requested
                        + " non può essere combinata con altre modalità (-f/-e/-d/-i sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseMaxAtoms(String value) {
            int maxAtoms;
            try {
                maxAtoms = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore -max non valido: " + value);
            }
            if (maxAtoms < 1 || maxAtoms > AssignmentEnumerator.HARD_MAX_ATOMS) {
                throw new IllegalArgumentException("Limite atomi deve essere tra 1 e "
                        + AssignmentEnumerator.HARD_MAX_ATOMS + ", ricevuto: " + maxAtoms);
            }
            return maxAtoms;
        }

        private IffPolicy parseIffPolicy(String value) {
            return switch (value) {
                case IFF_LEGACY -> IffPolicy.LEGACY_IMPLICATION;
                case IFF_BICONDITIONAL -> IffPolicy.BICONDITIONAL;
                default -> throw new IllegalArgumentException("Valore -iff non supportato: " + value
                        + ". Supportati: " + IFF_LEGACY + ", " + IFF_BICONDITIONAL);
            };
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

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
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
     * Risultato elaborazione batch con statistiche.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
