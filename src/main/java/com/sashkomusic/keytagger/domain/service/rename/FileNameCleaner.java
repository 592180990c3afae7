package com.sashkomusic.keytagger.domain.service.rename;

import com.sashkomusic.keytagger.domain.model.KeyNotation;
import com.sashkomusic.keytagger.domain.model.RenamePolicy;
import com.sashkomusic.keytagger.domain.model.ReplaceRule;
import com.sashkomusic.keytagger.domain.service.key.NotationTable;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * String side of renaming: turns an existing base name into the cleaned remainder and
 * composes the tagged name. Never touches the filesystem.
 */
@Component
@RequiredArgsConstructor
public class FileNameCleaner {

    private static final int WORD_FLAGS =
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern BPM_TOKEN = Pattern.compile("\\b\\d+\\s*bpm\\b", WORD_FLAGS);
    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s-]*", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String ILLEGAL_CHARACTERS = "<>:\"/\\|?*";

    private final NotationTable notationTable;

    public String displayKey(String keyLabel, KeyNotation notation) {
        return notationTable.displayKey(keyLabel, notation);
    }

    public String clean(String originalBase, RenamePolicy policy, String keyLabel) {
        String name = originalBase;

        for (String literal : policy.removeLiterals()) {
            if (literal != null && !literal.isEmpty()) {
                name = name.replace(literal, "");
            }
        }

        for (ReplaceRule rule : policy.replaceRules()) {
            if (rule.oldText() != null && !rule.oldText().isEmpty()) {
                name = name.replace(rule.oldText(), rule.newText() != null ? rule.newText() : "");
            }
        }

        name = purgeOtherNotation(name, policy.notation(), keyLabel);
        name = BPM_TOKEN.matcher(name).replaceAll("");

        return tidy(name);
    }

    public boolean isAlreadyNamed(String originalBase, String displayKey, int bpm) {
        return containsWord(originalBase, String.valueOf(bpm)) && containsWord(originalBase, displayKey);
    }

    public String composeCandidate(String displayKey, int bpm, String cleanedBase) {
        return sanitize(String.format("%s - %d BPM - %s", displayKey, bpm, cleanedBase));
    }

    public static String sanitize(String filename) {
        String sanitized = filename;
        for (char c : ILLEGAL_CHARACTERS.toCharArray()) {
            sanitized = sanitized.replace(c, '-');
        }
        return collapseWhitespace(sanitized);
    }

    private String purgeOtherNotation(String name, KeyNotation target, String keyLabel) {
        Optional<String> stale = target == KeyNotation.ALPHANUMERIC
                ? Optional.ofNullable(keyLabel)
                : notationTable.toAlphanumeric(keyLabel);

        return stale
                .filter(label -> !label.isEmpty())
                .map(label -> wholeWord(label).matcher(name).replaceAll(""))
                .orElse(name);
    }

    private static String tidy(String name) {
        String trimmed = name.strip();
        trimmed = LEADING_SEPARATORS.matcher(trimmed).replaceFirst("");
        return collapseWhitespace(trimmed);
    }

    private static String collapseWhitespace(String value) {
        return WHITESPACE_RUN.matcher(value.strip()).replaceAll(" ");
    }

    private static boolean containsWord(String text, String word) {
        return wholeWord(word).matcher(text).find();
    }

    // Lookarounds instead of \b so labels ending in '#' still match as a word
    private static Pattern wholeWord(String literal) {
        return Pattern.compile("(?<!\\w)" + Pattern.quote(literal) + "(?!\\w)", WORD_FLAGS);
    }
}
