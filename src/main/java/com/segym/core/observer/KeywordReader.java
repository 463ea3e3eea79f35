package com.segym.core.observer;

import com.segym.core.model.State;
import com.segym.core.model.TestCaseResult;
import com.segym.core.model.TestOutcome;
import com.segym.core.model.TestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Retrieval-based reader: ranks the files of the tree against a keyword query with Okapi BM25
 * and returns the best {@code maxFiles}.
 * <p>
 * With a blank configured query the terms come from the state's report: names and messages
 * of failing tests, or the tail of the test output when the report has no per-test results.
 */
public class KeywordReader implements Reader {

    private static final Logger log = LoggerFactory.getLogger(KeywordReader.class);

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_]+");
    private static final double K1 = 1.5;
    private static final double B = 0.75;
    private static final long MAX_FILE_BYTES = 1024 * 1024;
    private static final int OUTPUT_TAIL_CHARS = 4000;
    private static final Set<String> NOISE = Set.of(
            "test", "tests", "py", "java", "assert", "assertionerror", "self", "error", "line",
            "none", "null", "true", "false", "def", "class", "return", "the", "and", "where");

    private final List<String> queryTerms;
    private final int maxFiles;
    private final Set<String> extensions;

    /**
     * @param query      free-text query, tokenized on non-word characters; blank derives it from failing tests
     * @param maxFiles   number of files to return
     * @param extensions file extensions (without dot) to consider; empty means all files
     */
    public KeywordReader(String query, int maxFiles, Set<String> extensions) {
        this.queryTerms = tokenize(query);
        this.maxFiles = maxFiles;
        this.extensions = Set.copyOf(extensions);
    }

    @Override
    public SortedMap<String, String> read(State state) {
        List<String> terms = queryTerms.isEmpty() ? failureTerms(state.report()) : queryTerms;
        if (terms.isEmpty()) {
            log.debug("No query terms for state {}; nothing to read", state.slot());
            return new TreeMap<>();
        }
        Map<String, String> corpus = loadCorpus(state);
        if (corpus.isEmpty()) {
            return new TreeMap<>();
        }

        var termFrequencies = new HashMap<String, Map<String, Integer>>();
        var documentFrequency = new HashMap<String, Integer>();
        var lengths = new HashMap<String, Integer>();
        long totalLength = 0;
        for (var entry : corpus.entrySet()) {
            var tokens = tokenize(entry.getKey() + " " + entry.getValue());
            var tf = new HashMap<String, Integer>();
            for (String token : tokens) {
                tf.merge(token, 1, Integer::sum);
            }
            for (String term : tf.keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
            termFrequencies.put(entry.getKey(), tf);
            lengths.put(entry.getKey(), tokens.size());
            totalLength += tokens.size();
        }
        double averageLength = Math.max(1.0, (double) totalLength / corpus.size());
        int n = corpus.size();

        var scored = new ArrayList<Map.Entry<String, Double>>();
        for (String path : corpus.keySet()) {
            var tf = termFrequencies.get(path);
            double score = 0;
            for (String term : terms) {
                int f = tf.getOrDefault(term, 0);
                if (f == 0) continue;
                int df = documentFrequency.getOrDefault(term, 0);
                double idf = Math.log((n - df + 0.5) / (df + 0.5) + 1.0);
                double norm = f + K1 * (1 - B + B * lengths.get(path) / averageLength);
                score += idf * (f * (K1 + 1)) / norm;
            }
            if (score > 0) {
                scored.add(Map.entry(path, score));
            }
        }
        scored.sort(Comparator.<Map.Entry<String, Double>>comparingDouble(Map.Entry::getValue).reversed()
                .thenComparing(Map.Entry::getKey));

        var result = new TreeMap<String, String>();
        for (var entry : scored.subList(0, Math.min(maxFiles, scored.size()))) {
            result.put(entry.getKey(), corpus.get(entry.getKey()));
        }
        log.debug("Keyword query {} matched {} file(s), kept {}", terms, scored.size(), result.size());
        return result;
    }

    private Map<String, String> loadCorpus(State state) {
        var corpus = new TreeMap<String, String>();
        Path root = state.root();
        try (Stream<Path> walk = Files.walk(root)) {
            var files = walk.filter(Files::isRegularFile)
                    .filter(p -> !TreeFiles.isIgnored(root, p))
                    .filter(this::hasWantedExtension)
                    .toList();
            for (Path file : files) {
                if (Files.size(file) > MAX_FILE_BYTES) continue;
                String relative = root.relativize(file).toString().replace('\\', '/');
                corpus.put(relative, TreeFiles.read(state, relative));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }
        for (var entry : state.overlay().entrySet()) {
            if (hasWantedExtension(Path.of(entry.getKey()))) {
                corpus.put(entry.getKey(), entry.getValue());
            }
        }
        return corpus;
    }

    private boolean hasWantedExtension(Path path) {
        if (extensions.isEmpty()) {
            return true;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * Query terms describing what fails in {@code report}. Snake-case identifiers are also
     * split into their parts, so {@code test_add} finds a file defining {@code add}.
     */
    static List<String> failureTerms(TestReport report) {
        if (report == null) {
            return List.of();
        }
        var text = new StringBuilder();
        for (TestCaseResult testCase : report.testCases()) {
            if (testCase.outcome() == TestOutcome.FAILED || testCase.outcome() == TestOutcome.ERROR) {
                text.append(testCase.name()).append(' ');
                if (testCase.message() != null) {
                    text.append(testCase.message()).append(' ');
                }
            }
        }
        if (text.length() == 0 && report.failingCount() > 0) {
            String output = report.output();
            text.append(output, Math.max(0, output.length() - OUTPUT_TAIL_CHARS), output.length());
        }
        var terms = new LinkedHashSet<String>();
        for (String token : tokenize(text.toString())) {
            if (isUsefulTerm(token)) {
                terms.add(token);
            }
            for (String part : token.split("_")) {
                if (isUsefulTerm(part)) {
                    terms.add(part);
                }
            }
        }
        return List.copyOf(terms);
    }

    private static boolean isUsefulTerm(String term) {
        return term.length() > 2 && !NOISE.contains(term) && !term.chars().allMatch(Character::isDigit);
    }

    static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        if (text == null) {
            return tokens;
        }
        var matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return tokens;
    }
}
