package com.example.redline.application.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Instruction text with every quoted span replaced by a numbered placeholder, so that instruction
 * patterns never match words inside quoted matter. A double quote at the start of a line inside an
 * open quotation continues a multi-paragraph quotation.
 */
final class QuotedText {
    static final char OPEN = '\u27E6';
    static final char CLOSE = '\u27E7';
    static final String PLACEHOLDER = OPEN + "(\\d+)" + CLOSE;

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile(PLACEHOLDER);
    private static final Pattern CONTINUATION_QUOTE = Pattern.compile("(?m)^([ \\t]*)\"");

    private final String masked;
    private final List<String> quotes;
    private final List<Character> delimiters;

    private QuotedText(String masked, List<String> quotes, List<Character> delimiters) {
        this.masked = masked;
        this.quotes = quotes;
        this.delimiters = delimiters;
    }

    static QuotedText mask(String text) {
        StringBuilder masked = new StringBuilder(text.length());
        List<String> quotes = new ArrayList<>();
        List<Character> delimiters = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int close = -1;
            if (c == '"') {
                close = closingDoubleQuote(text, i);
            } else if (c == '\'' && (i == 0 || !Character.isLetterOrDigit(text.charAt(i - 1)))) {
                close = closingSingleQuote(text, i);
            }
            if (close < 0) {
                masked.append(c);
                i++;
                continue;
            }
            masked.append(OPEN).append(quotes.size()).append(CLOSE);
            quotes.add(text.substring(i + 1, close));
            delimiters.add(c);
            i = close + 1;
        }
        return new QuotedText(masked.toString(), List.copyOf(quotes), List.copyOf(delimiters));
    }

    String masked() {
        return masked;
    }

    int size() {
        return quotes.size();
    }

    /** Content of a quotation with the continuation quotes of later paragraphs removed. */
    String quote(int index) {
        return CONTINUATION_QUOTE.matcher(quotes.get(index)).replaceAll("$1");
    }

    /** Restores the quotations inside a fragment of the masked text. */
    String unmask(String fragment) {
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(fragment);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            char delimiter = delimiters.get(index);
            matcher.appendReplacement(
                    sb, Matcher.quoteReplacement(delimiter + quotes.get(index) + delimiter));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static int closingDoubleQuote(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            if (text.charAt(i) == '"' && !isLineStart(text, i)) {
                return i;
            }
        }
        return -1;
    }

    private static int closingSingleQuote(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                return -1;
            }
            if (c == '\'' && i > open + 1
                    && (i + 1 >= text.length() || !Character.isLetterOrDigit(text.charAt(i + 1)))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isLineStart(String text, int position) {
        for (int i = position - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return false;
    }
}
