package org.entailment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.entailment.Main.ArgumentParser;
import org.entailment.Main.Mode;
import org.entailment.Main.VerifierConfiguration;
import org.entailment.parser.FormulaParseException;
import org.entailment.parser.IffPolicy;
import org.entailment.parser.InvalidKnowledgeBaseException;
import org.entailment.support.AssignmentEnumerator;
import org.entailment.support.ResourceLimitExceededException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

    @TempDir
    Path tempDir;

    private final ArgumentParser parser = new ArgumentParser();

    //region PARAMETRI

    @Test
    void parseFileModeWithDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve("formula.txt"), "a and b\n");

        VerifierConfiguration config = parser.parse(new String[] {"-f", file.toString()});

        assertThat(config.mode).isEqualTo(Mode.FORMULA_FILE);
        assertThat(config.inputPath).isEqualTo(file.toString());
        assertThat(config.outputPath).isNull();
        assertThat(config.maxAtoms).isEqualTo(AssignmentEnumerator.DEFAULT_MAX_ATOMS);
        assertThat(config.iffPolicy).isEqualTo(IffPolicy.BICONDITIONAL);
    }

    @Test
    void parseEntailmentModeWithOptions() throws IOException {
        Path file = Files.writeString(tempDir.resolve("kb.kb"), "a\nb\n");
        Path output = tempDir.resolve("out");

        VerifierConfiguration config = parser.parse(new String[] {
                "-e", file.toString(), "-o", output.toString(), "-max=12", "-iff=legacy"});

        assertThat(config.mode).isEqualTo(Mode.ENTAILMENT_FILE);
        assertThat(config.maxAtoms).isEqualTo(12);
        assertThat(config.iffPolicy).isEqualTo(IffPolicy.LEGACY_IMPLICATION);
        assertThat(output).isDirectory();
    }

    @Test
    void parseInteractiveModes() {
        assertThat(parser.parse(new String[] {"-i"}).mode).isEqualTo(Mode.INTERACTIVE_FORMULA);
        assertThat(parser.parse(new String[] {"-i=entail"}).mode).isEqualTo(Mode.INTERACTIVE_ENTAILMENT);
    }

    @Test
    void parseHelpReturnsNull() {
        assertThat(parser.parse(new String[] {"-h"})).isNull();
    }

    @Test
    void parseRejectsInvalidArguments() {
        assertThatThrownBy(() -> parser.parse(new String[] {"-x"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-x");
        assertThatThrownBy(() -> parser.parse(new String[] {"-max=0", "-i"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse(new String[] {"-max=25", "-i"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse(new String[] {"-iff=other", "-i"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse(new String[] {"-f"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse(new String[] {"-max=10"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseRejectsMissingFileAndCombinedModes() {
        String missing = tempDir.resolve("missing.txt").toString();

        assertThatThrownBy(() -> parser.parse(new String[] {"-f", missing}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non esistente");
        assertThatThrownBy(() -> parser.parse(new String[] {"-i", "-d", tempDir.toString()}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse(new String[] {"-i", "-o", tempDir.toString()}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    //endregion

    //region REPORT

    @Test
    void formulaReportListsTokensTreeAtomsAndAssignments() {
        String report = Main.buildFormulaReport("a and b", configuration(IffPolicy.BICONDITIONAL, 20));

        assertThat(report)
                .contains("Token: [Atom(a), And, Atom(b)]")
                .contains("Albero: And(Atom(a), Atom(b))")
                .contains("Atomi: [a, b]")
                .contains("RISULTATO: SODDISFACIBILE")
                .contains("Assegnamenti soddisfacenti (1):")
                .contains("{a=true, b=true}")
                .contains("Assegnamenti falsificanti (3):");
    }

    @Test
    void formulaReportClassifiesValidAndUnsatisfiable() {
        VerifierConfiguration config = configuration(IffPolicy.BICONDITIONAL, 20);

        assertThat(Main.buildFormulaReport("a or not a", config)).contains("VALIDA");
        assertThat(Main.buildFormulaReport("a and not a", config)).contains("INSODDISFACIBILE");
    }

    @Test
    void formulaReportPropagatesErrors() {
        assertThatThrownBy(() -> Main.buildFormulaReport("(a and b", configuration(IffPolicy.BICONDITIONAL, 20)))
                .isInstanceOf(FormulaParseException.class);
        assertThatThrownBy(() -> Main.buildFormulaReport("a and b and c", configuration(IffPolicy.BICONDITIONAL, 2)))
                .isInstanceOf(ResourceLimitExceededException.class);
    }

    @Test
    void entailmentReportShowsVerdictAndCounterModel() {
        VerifierConfiguration config = configuration(IffPolicy.BICONDITIONAL, 20);

        assertThat(Main.buildEntailmentReport("a, if a then b", "b", config))
                .contains("KB ⊨ α: true")
                .doesNotContain("Controesempio");
        assertThat(Main.buildEntailmentReport("a or b", "a", config))
                .contains("KB ⊨ α: false")
                .contains("Controesempio: {a=false, b=true}");
    }

    @Test
    void entailmentReportHonoursLegacyIff() {
        String biconditional = Main.buildEntailmentReport("iff a then b", "if b then a",
                configuration(IffPolicy.BICONDITIONAL, 20));
        String legacy = Main.buildEntailmentReport("iff a then b", "if b then a",
                configuration(IffPolicy.LEGACY_IMPLICATION, 20));

        assertThat(biconditional).contains("KB ⊨ α: true");
        assertThat(legacy).contains("KB ⊨ α: false");
    }

    @Test
    void entailmentReportRejectsInvalidKnowledgeBase() {
        assertThatThrownBy(() -> Main.buildEntailmentReport("a, b c", "a", configuration(IffPolicy.BICONDITIONAL, 20)))
                .isInstanceOf(InvalidKnowledgeBaseException.class)
                .hasMessageContaining("n. 2");
    }

    @Test
    void interactiveFormulaReadsStandardInput() {
        ByteArrayInputStream input = new ByteArrayInputStream("not a\n".getBytes(StandardCharsets.UTF_8));
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;

        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
        try {
            Main.processInteractiveFormula(configuration(IffPolicy.BICONDITIONAL, 20), input);
        } finally {
            System.setOut(originalOut);
        }

        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("Albero: Not(Atom(a))")
                .contains("{a=false}");
    }

    @Test
    void interactiveEntailmentReportsSyntaxErrorsWithoutThrowing() {
        ByteArrayInputStream input = new ByteArrayInputStream("a\nthen b\n".getBytes(StandardCharsets.UTF_8));
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;

        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
        try {
            Main.processInteractiveEntailment(configuration(IffPolicy.BICONDITIONAL, 20), input);
        } finally {
            System.setOut(originalOut);
        }

        assertThat(output.toString(StandardCharsets.UTF_8)).contains("[E] Input non valido");
    }

    @Test
    void interactiveFormulaReportsOverDeepNestingWithoutThrowing() {
        String deep = "(".repeat(5000) + "a" + ")".repeat(5000) + "\n";
        ByteArrayInputStream input = new ByteArrayInputStream(deep.getBytes(StandardCharsets.UTF_8));
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;

        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
        try {
            Main.processInteractiveFormula(configuration(IffPolicy.BICONDITIONAL, 20), input);
        } finally {
            System.setOut(originalOut);
        }

        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("[E] Input non valido")
                .contains("Annidamento troppo profondo");
    }

    //endregion

    //region PERCORSI

    @Test
    void findInputFilesSortsFormulaAndKnowledgeBaseFiles() throws IOException {
        Files.writeString(tempDir.resolve("b.txt"), "a");
        Files.writeString(tempDir.resolve("a.kb"), "a\na");
        Files.writeString(tempDir.resolve("c.md"), "ignored");

        List<File> files = Main.findInputFiles(tempDir.toString());

        assertThat(files).extracting(File::getName).containsExactly("a.kb", "b.txt");
    }

    @Test
    void outputDirectoryDefaultsToInputDirectory() {
        VerifierConfiguration config = configuration(IffPolicy.BICONDITIONAL, 20);
        String input = tempDir.resolve("formula.txt").toString();

        assertThat(Main.getOutputDirectory(config, input)).isEqualTo(tempDir.resolve("RESULT"));
        assertThat(Main.getBaseFileName(input)).isEqualTo("formula");
    }

    //endregion

    private static VerifierConfiguration configuration(IffPolicy iffPolicy, int maxAtoms) {
        return new VerifierConfiguration(Mode.FORMULA_FILE, null, null, maxAtoms, iffPolicy);
    }
}
