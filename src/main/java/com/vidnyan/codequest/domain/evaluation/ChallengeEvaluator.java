package com.vidnyan.codequest.domain.evaluation;

import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.level.Challenge;
import com.vidnyan.codequest.domain.level.Level;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Grades learner answers against challenge answer payloads.
 * <p>
 * Expected answer keys per type:
 * <ul>
 *   <li>MULTIPLE_CHOICE: {@code answer}</li>
 *   <li>CODE_TRACING: {@code trace} (list of names), prefix partial credit</li>
 *   <li>FILL_BLANK: {@code fill}, or {@code fills} (map) with per-blank partial credit</li>
 *   <li>CODE_COMPLETION: {@code code}</li>
 *   <li>DEBUGGING: {@code fixed_code}</li>
 *   <li>ARCHITECTURE: {@code pattern}</li>
 * </ul>
 */
@Component
public class ChallengeEvaluator {

    public static final double COMPLETION_THRESHOLD = 0.7;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_COMMENT = Pattern.compile("(#|//).*$", Pattern.MULTILINE);

    public ChallengeResult evaluate(Challenge challenge, Map<String, Object> answer) {
        Map<String, Object> given = answer != null ? answer : Map.of();
        return switch (challenge.type()) {
            case MULTIPLE_CHOICE -> choice(challenge, text(given.get("answer")),
                    text(challenge.answer().get("correct")), "The correct answer is: ");
            case CODE_TRACING -> trace(challenge, given);
            case FILL_BLANK -> fillBlank(challenge, given);
            case CODE_COMPLETION -> code(challenge, text(given.get("code")));
            case DEBUGGING -> code(challenge, text(given.get("fixed_code")));
            case ARCHITECTURE -> choice(challenge, text(given.get("pattern")),
                    text(challenge.answer().get("pattern")), "The pattern used is: ");
        };
    }

    /**
     * Grade every challenge of a level. Answers are keyed by challenge id; missing answers score zero.
     */
    public LevelResult evaluateLevel(Level level, Map<String, Map<String, Object>> answers) {
        List<ChallengeResult> results = new ArrayList<>();
        int score = 0;
        int maxScore = level.maxScore();
        for (Challenge challenge : level.challenges()) {
            ChallengeResult result = evaluate(challenge, answers.getOrDefault(challenge.id(), Map.of()));
            results.add(result);
            score += result.pointsEarned();
        }
        boolean completed = maxScore > 0 && score >= maxScore * COMPLETION_THRESHOLD;
        return new LevelResult(level.id(), completed, score, maxScore, score == maxScore, results);
    }

    private ChallengeResult choice(Challenge challenge, String given, String correct, String reveal) {
        if (given.trim().equalsIgnoreCase(correct.trim())) {
            return right(challenge, "Correct!");
        }
        return wrong(challenge, 0, "Incorrect. " + reveal + correct.trim());
    }

    private ChallengeResult trace(Challenge challenge, Map<String, Object> given) {
        List<String> expected = strings(challenge.answer().get("chain"));
        if (expected.isEmpty()) {
            return wrong(challenge, 0, "No correct answer defined");
        }
        List<String> actual = strings(given.get("trace"));
        int matched = 0;
        while (matched < actual.size() && matched < expected.size()
                && actual.get(matched).equals(expected.get(matched))) {
            matched++;
        }
        int points = challenge.points() * matched / expected.size();
        if (matched == expected.size()) {
            return right(challenge, "Perfect trace! " + CallGraph.formatChain(expected));
        }
        if (matched > 0) {
            return wrong(challenge, points, "Partially correct (" + matched + "/" + expected.size()
                    + " steps). You got up to: " + CallGraph.formatChain(actual.subList(0, matched)));
        }
        return wrong(challenge, 0, "Incorrect. The execution flow is: " + CallGraph.formatChain(expected));
    }

    private ChallengeResult fillBlank(Challenge challenge, Map<String, Object> given) {
        if (given.containsKey("fill")) {
            String correct = text(challenge.answer().get("fill"));
            if (squash(text(given.get("fill"))).equals(squash(correct))) {
                return right(challenge, "Correct!");
            }
            return wrong(challenge, 0, "Incorrect. The answer is: " + correct.trim());
        }

        Map<?, ?> expected = challenge.answer().get("fills") instanceof Map<?, ?> m ? m : Map.of();
        if (expected.isEmpty()) {
            return wrong(challenge, 0, "No correct answer defined");
        }
        Map<?, ?> actual = given.get("fills") instanceof Map<?, ?> fills ? fills : Map.of();
        int matched = 0;
        for (Map.Entry<?, ?> blank : expected.entrySet()) {
            if (squash(text(actual.get(blank.getKey()))).equals(squash(text(blank.getValue())))) {
                matched++;
            }
        }
        if (matched == expected.size()) {
            return right(challenge, "All " + matched + " blanks filled correctly!");
        }
        return wrong(challenge, challenge.points() * matched / expected.size(),
                matched + "/" + expected.size() + " blanks correct.");
    }

    private ChallengeResult code(Challenge challenge, String submitted) {
        String code = submitted.trim();
        Map<String, Object> expected = challenge.answer();
        if (expected.containsKey("patterns")) {
            List<String> patterns = strings(expected.get("patterns"));
            long found = patterns.stream().filter(code::contains).count();
            if (found == patterns.size()) {
                return right(challenge, "Code looks good! All required patterns present.");
            }
            return wrong(challenge, (int) (challenge.points() * found / patterns.size()),
                    "Missing some required patterns (" + found + "/" + patterns.size() + " found).");
        }
        String reference = expected.containsKey("code") ? text(expected.get("code"))
                : expected.containsKey("fixed_code") ? text(expected.get("fixed_code")) : null;
        if (reference == null) {
            return right(challenge, "Code submitted (auto-graded)");
        }
        if (normalizeCode(code).equals(normalizeCode(reference))) {
            return right(challenge, "Perfect code!");
        }
        return wrong(challenge, 0, "Code doesn't match expected solution.");
    }

    private static ChallengeResult right(Challenge challenge, String feedback) {
        return new ChallengeResult(challenge.id(), true, challenge.points(), challenge.points(), feedback, List.of());
    }

    private static ChallengeResult wrong(Challenge challenge, int points, String feedback) {
        return new ChallengeResult(challenge.id(), false, points, challenge.points(), feedback, challenge.hints());
    }

    static String normalizeCode(String code) {
        String stripped = LINE_COMMENT.matcher(code).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    private static String squash(String value) {
        return WHITESPACE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private static String text(Object value) {
        return value != null ? value.toString() : "";
    }

    private static List<String> strings(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : items) {
            result.add(text(item));
        }
        return result;
    }
}
