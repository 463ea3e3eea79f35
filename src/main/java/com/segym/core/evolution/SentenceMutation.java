package com.segym.core.evolution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local text edits on a prompt: drop a sentence, swap two adjacent sentences, substitute a
 * synonym, or insert a repair-oriented clause. Falls back to inserting a clause whenever the
 * chosen edit leaves the text unchanged, so the result always differs from the input.
 */
public class SentenceMutation implements MutationOperator {

    static final List<String> CLAUSES = List.of(
            "Read the failing test carefully before changing any code.",
            "Keep the change as small as possible.",
            "Preserve the existing code style.",
            "Consider edge cases such as empty inputs and missing values.",
            "Do not modify the tests.",
            "Make sure oldCode matches the file exactly, including whitespace.",
            "Prefer fixing the root cause over special-casing the test.",
            "Check the types and return values of the functions involved."
    );

    static final Map<String, String> SYNONYMS = Map.of(
            "fix", "repair",
            "bug", "defect",
            "change", "edit",
            "carefully", "thoroughly",
            "small", "minimal",
            "error", "fault",
            "ensure", "make sure",
            "function", "routine"
    );

    private enum Edit { DROP, SWAP, SYNONYM, INSERT }

    @Override
    public String mutate(String prompt, double reward, Random random) {
        var segments = PromptSegments.split(prompt);
        Edit edit = Edit.values()[random.nextInt(Edit.values().length)];
        String mutated = switch (edit) {
            case DROP -> drop(segments, random);
            case SWAP -> swap(segments, random);
            case SYNONYM -> substitute(prompt, random);
            case INSERT -> insert(segments, random);
        };
        if (mutated == null || mutated.isBlank() || mutated.equals(prompt)) {
            mutated = insert(segments, random);
        }
        if (mutated.equals(prompt)) {
            mutated = prompt + " " + CLAUSES.get(random.nextInt(CLAUSES.size()));
        }
        return mutated;
    }

    private String drop(List<String> segments, Random random) {
        if (segments.size() < 2) {
            return null;
        }
        var copy = new ArrayList<>(segments);
        copy.remove(random.nextInt(copy.size()));
        return PromptSegments.join(copy);
    }

    private String swap(List<String> segments, Random random) {
        if (segments.size() < 2) {
            return null;
        }
        var copy = new ArrayList<>(segments);
        int i = random.nextInt(copy.size() - 1);
        String tmp = copy.get(i);
        copy.set(i, copy.get(i + 1));
        copy.set(i + 1, tmp);
        return PromptSegments.join(copy);
    }

    private String substitute(String prompt, Random random) {
        var candidates = new ArrayList<String>();
        for (String word : SYNONYMS.keySet()) {
            if (wordPattern(word).matcher(prompt).find()) {
                candidates.add(word);
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }
        candidates.sort(String::compareTo);
        String word = candidates.get(random.nextInt(candidates.size()));
        return wordPattern(word).matcher(prompt).replaceFirst(Matcher.quoteReplacement(SYNONYMS.get(word)));
    }

    private String insert(List<String> segments, Random random) {
        var unused = new ArrayList<String>();
        for (String clause : CLAUSES) {
            if (!segments.contains(clause)) {
                unused.add(clause);
            }
        }
        var pool = unused.isEmpty() ? CLAUSES : unused;
        var copy = new ArrayList<>(segments);
        copy.add(random.nextInt(copy.size() + 1), pool.get(random.nextInt(pool.size())));
        return PromptSegments.join(copy);
    }

    private static Pattern wordPattern(String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b");
    }
}
