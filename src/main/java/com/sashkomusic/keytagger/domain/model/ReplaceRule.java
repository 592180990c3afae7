package com.sashkomusic.keytagger.domain.model;

public record ReplaceRule(String oldText, String newText) {
}
