package com.segym.core.observer;

import com.segym.core.model.State;
import com.segym.core.model.TestCaseResult;
import com.segym.core.model.TestOutcome;
import com.segym.core.model.TestReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordReaderTest {

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("calc.py"), """
                def add(a, b):
                    return a - b

                def subtract(a, b):
                    return a - b
                """);
        Files.writeString(root.resolve("strings.py"), """
                def shout(text):
                    return text.upper()
                """);
        Files.writeString(root.resolve("notes.txt"), "add add add add");
        Files.createDirectories(root.resolve("__pycache__"));
        Files.writeString(root.resolve("__pycache__/calc.py"), "add add add add add");
    }

    private State state(Map<String, String> overlay) {
        return new State(0, 1, root, overlay, null, TestReport.fromCases(0, List.of(), ""), false, null);
    }

    @Test
    @DisplayName("ranks the file mentioning the query terms first")
    void ranksByRelevance() {
        var files = new KeywordReader("test_add add", 1, Set.of("py")).read(state(Map.of()));

        assertEquals(List.of("calc.py"), List.copyOf(files.keySet()));
    }

    @Test
    @DisplayName("skips ignored directories and unwanted extensions")
    void filters() {
        var files = new KeywordReader("add", 10, Set.of("py")).read(state(Map.of()));

        assertEquals(Set.of("calc.py"), files.keySet());
    }

    @Test
    @DisplayName("an empty extension set considers every file")
    void allExtensions() {
        var files = new KeywordReader("add", 10, Set.of()).read(state(Map.of()));

        assertTrue(files.containsKey("notes.txt"));
        assertTrue(files.containsKey("calc.py"));
    }

    @Test
    @DisplayName("overlay contents are searched instead of the canonical file")
    void searchesOverlay() {
        var files = new KeywordReader("shout", 5, Set.of("py"))
                .read(state(Map.of("calc.py", "def add(a, b):\n    return shout(a + b)\n")));

        assertEquals(Set.of("calc.py", "strings.py"), files.keySet());
        assertTrue(files.get("calc.py").contains("shout(a + b)"));
    }

    @Test
    @DisplayName("is deterministic for the same state")
    void deterministic() {
        var reader = new KeywordReader("return a b", 2, Set.of("py"));

        assertEquals(reader.read(state(Map.of())), reader.read(state(Map.of())));
    }

    @Test
    @DisplayName("a blank query on a green state reads nothing")
    void blankQueryReadsNothing() {
        assertTrue(new KeywordReader("  ", 5, Set.of()).read(state(Map.of())).isEmpty());
    }

    @Test
    @DisplayName("a blank query is built from the failing tests of the state")
    void queryFromFailingTests() {
        var report = TestReport.fromCases(1, List.of(
                new TestCaseResult("test_calc.test_add", TestOutcome.FAILED, "assert -1 == 3"),
                new TestCaseResult("test_strings.test_upper", TestOutcome.PASSED, null)), "");
        var red = new State(State.BASELINE_SLOT, 1, root, Map.of(), null, report, false, null);

        var files = new KeywordReader("", 5, Set.of("py")).read(red);

        assertEquals(Set.of("calc.py"), files.keySet());
    }

    @Test
    @DisplayName("without per-test results the query comes from the test output")
    void queryFromOutput() {
        var report = new TestReport(1, 0, 1, 0, 0, List.of(),
                "FAILED test_calc.py::test_add - assert -1 == 3\n1 failed in 0.02s");
        var red = new State(State.BASELINE_SLOT, 1, root, Map.of(), null, report, false, null);

        var files = new KeywordReader("", 5, Set.of("py")).read(red);

        assertTrue(files.containsKey("calc.py"));
    }

    @Test
    void failureTermsSplitIdentifiersAndDropNoise() {
        var report = TestReport.fromCases(1, List.of(
                new TestCaseResult("tests.test_calc.test_add", TestOutcome.ERROR, "AssertionError: assert -1 == 3")), "");

        var terms = KeywordReader.failureTerms(report);

        assertTrue(terms.containsAll(List.of("test_calc", "calc", "test_add", "add")));
        assertFalse(terms.contains("test"));
        assertFalse(terms.contains("3"));
        assertFalse(terms.contains("assertionerror"));
    }

    @Test
    @DisplayName("files that are not UTF-8 are read with replacement characters")
    void latin1File() throws IOException {
        Files.write(root.resolve("legacy.py"),
                "# -*- coding: latin-1 -*-\ndef add(a, b):  # caf\u00e9\n    return a + b\n"
                        .getBytes(StandardCharsets.ISO_8859_1));

        var files = new KeywordReader("add", 5, Set.of("py")).read(state(Map.of()));

        assertTrue(files.containsKey("legacy.py"));
        assertTrue(files.get("legacy.py").contains("\uFFFD"));
    }

    @Test
    void tokenizeLowercases() {
        assertEquals(List.of("test_add", "assertionerror", "3"), KeywordReader.tokenize("test_add: AssertionError 3"));
    }
}
