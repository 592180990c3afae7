package com.sashkomusic.keytagger.infrastructure.console;

import com.sashkomusic.keytagger.domain.model.KeyNotation;
import com.sashkomusic.keytagger.domain.model.RenamePolicy;
import com.sashkomusic.keytagger.domain.model.ReplaceRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Component
public class RenamePolicyParser {

    public RenamePolicy parse(boolean renameEnabled, String notation, String remove, String replace) {
        return new RenamePolicy(
                renameEnabled,
                KeyNotation.parse(notation),
                parseRemoveList(remove),
                parseReplaceRules(replace)
        );
    }

    public List<String> parseRemoveList(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    // old:new, split on the first colon
    public List<ReplaceRule> parseReplaceRules(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<ReplaceRule> rules = new ArrayList<>();
        for (String entry : text.split(",")) {
            String pair = entry.trim();
            int colon = pair.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            rules.add(new ReplaceRule(pair.substring(0, colon), pair.substring(colon + 1)));
        }
        return rules;
    }
}
