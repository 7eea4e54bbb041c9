package org.dxworks.coqu.analyzer.cobol.preprocessor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed {@code REPLACING} operands of a COPY statement.
 * Pseudo-text pairs replace raw substrings; word pairs replace whole COBOL words, ignoring case.
 */
public final class ReplacingClause {

    private static final Pattern PSEUDO_TEXT = Pattern.compile(
            "==(.+?)==\\s+BY\\s+==(.*?)==", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern WORD_PAIR = Pattern.compile(
            "(?<![A-Z0-9-])([A-Z][A-Z0-9-]*)\\s+BY\\s+([A-Z][A-Z0-9-]*)(?![A-Z0-9-])", Pattern.CASE_INSENSITIVE);

    private final List<String[]> pseudoText;
    private final List<WordPair> words;

    private ReplacingClause(List<String[]> pseudoText, List<WordPair> words) {
        this.pseudoText = pseudoText;
        this.words = words;
    }

    public static ReplacingClause parse(String clause) {
        List<String[]> pseudoText = new ArrayList<>();
        List<WordPair> words = new ArrayList<>();
        if (clause == null || clause.isBlank()) {
            return new ReplacingClause(pseudoText, words);
        }

        Matcher pseudo = PSEUDO_TEXT.matcher(clause);
        StringBuilder remainder = new StringBuilder();
        int last = 0;
        while (pseudo.find()) {
            pseudoText.add(new String[]{pseudo.group(1).trim(), pseudo.group(2).trim()});
            remainder.append(clause, last, pseudo.start()).append(' ');
            last = pseudo.end();
        }
        remainder.append(clause.substring(last));

        Matcher word = WORD_PAIR.matcher(remainder);
        while (word.find()) {
            words.add(new WordPair(word.group(1), word.group(2)));
        }
        return new ReplacingClause(pseudoText, words);
    }

    public boolean isEmpty() {
        return pseudoText.isEmpty() && words.isEmpty();
    }

    public String apply(String content) {
        String result = content;
        for (String[] pair : pseudoText) {
            if (!pair[0].isEmpty()) {
                result = result.replace(pair[0], pair[1]);
            }
        }
        for (WordPair pair : words) {
            result = pair.word.matcher(result).replaceAll(pair.replacement);
        }
        return result;
    }

    private static final class WordPair {
        final Pattern word;
        final String replacement;

        WordPair(String word, String replacement) {
            this.word = Pattern.compile(
                    "(?<![A-Z0-9-])" + Pattern.quote(word) + "(?![A-Z0-9-])", Pattern.CASE_INSENSITIVE);
            this.replacement = Matcher.quoteReplacement(replacement);
        }
    }
}
