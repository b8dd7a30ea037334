package com.sprintreport.infrastructure.cache;

import java.util.regex.Pattern;

/**
 * Glob matching for in-process pattern deletes, same syntax as Redis SCAN MATCH
 * restricted to {@code *} and {@code ?}.
 */
final class KeyPatterns {

    private KeyPatterns() {
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder("^");
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.append('$').toString());
    }
}
