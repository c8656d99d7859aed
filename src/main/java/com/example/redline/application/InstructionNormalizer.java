package com.example.redline.application;

import org.springframework.stereotype.Component;

/**
 * Folds typographic quotes, primes and dashes to the ASCII forms the instruction patterns expect and
 * converts line endings to {@code \n}. Nothing else is rewritten.
 */
@Component
public class InstructionNormalizer {

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\u201C', '\u201D', '\u201E', '\u201F', '\u2033', '\u2036' -> sb.append('"');
                case '\u2018', '\u2019', '\u201A', '\u201B', '\u2032', '\u2035' -> sb.append('\'');
                case '\u2010', '\u2011', '\u2012', '\u2013' -> sb.append('-');
                case '\u2015' -> sb.append('\u2014');
                case '\u00A0', '\u2009', '\u202F' -> sb.append(' ');
                case '\r' -> {
                    if (i + 1 >= text.length() || text.charAt(i + 1) != '\n') {
                        sb.append('\n');
                    }
                }
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
