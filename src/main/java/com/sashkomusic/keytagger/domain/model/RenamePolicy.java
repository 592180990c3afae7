package com.sashkomusic.keytagger.domain.model;

import java.util.List;

public record RenamePolicy(
        boolean renameEnabled,
        KeyNotation notation,
        List<String> removeLiterals,
        List<ReplaceRule> replaceRules
) {
    public RenamePolicy {
        notation = notation != null ? notation : KeyNotation.CLASSIC;
        removeLiterals = removeLiterals != null ? List.copyOf(removeLiterals) : List.of();
        replaceRules = replaceRules != null ? List.copyOf(replaceRules) : List.of();
    }

    public static RenamePolicy defaults() {
        return new RenamePolicy(true, KeyNotation.CLASSIC, List.of(), List.of());
    }
}
