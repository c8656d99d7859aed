package com.example.redline.application.detect;

import com.example.redline.domain.Citation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts the instruction text that belongs to a citation out of the document. The window runs from
 * the citation to the next boundary: a later citation outside quoted matter, a bill section heading
 * or a bill-level subdivision heading. Item markers such as {@code (A) by striking} are part of the
 * instruction and never end it.
 */
@Component
public class InstructionContextExtractor {
    private static final Pattern SECTION_HEADING =
            Pattern.compile("(?m)^[ \\t]*(?:SEC\\.|Sec\\.|SECTION)\\s+\\d+[A-Za-z]?\\.");
    private static final Pattern SUBDIVISION_HEADING =
            Pattern.compile("(?m)^[ \\t]*\\([a-z0-9]{1,4}\\)\\s+[A-Z][A-Z0-9 ,'&-]{2,}\\.?\\s*(?:—|--)");

    private final int maxContextChars;

    public InstructionContextExtractor(
            @Value("${redline.parser.max-context-chars:4000}") int maxContextChars) {
        this.maxContextChars = Math.max(1, maxContextChars);
    }

    public String extract(String text, List<Citation> citations, int index) {
        Citation citation = citations.get(index);
        int start = citation.startOffset();
        int limit = Math.min(text.length(), start + maxContextChars);
        int[] quoteDepth = quoteDepths(text, start, limit);

        int end = limit;
        for (int i = index + 1; i < citations.size(); i++) {
            int candidate = citations.get(i).startOffset();
            if (candidate >= limit) {
                break;
            }
            if (candidate >= citation.endOffset() && quoteDepth[candidate - start] == 0) {
                end = candidate;
                break;
            }
        }
        end = Math.min(end, firstUnquoted(SECTION_HEADING.matcher(text), citation.endOffset(), end, start, quoteDepth));
        end = Math.min(end, firstUnquoted(SUBDIVISION_HEADING.matcher(text), citation.endOffset(), end, start, quoteDepth));
        return text.substring(start, end);
    }

    private int firstUnquoted(Matcher matcher, int from, int to, int windowStart, int[] quoteDepth) {
        matcher.region(from, to);
        while (matcher.find()) {
            if (quoteDepth[matcher.start() - windowStart] == 0) {
                return matcher.start();
            }
        }
        return to;
    }

    /**
     * Quote nesting before each position of the window. A double quote at the start of a line inside
     * quoted matter continues a multi-paragraph quotation instead of closing it.
     */
    private int[] quoteDepths(String text, int start, int limit) {
        int[] depths = new int[limit - start + 1];
        int depth = 0;
        for (int pos = start; pos < limit; pos++) {
            depths[pos - start] = depth;
            char c = text.charAt(pos);
            boolean lineStart = isLineStart(text, start, pos);
            if (c == '\u201C') {
                if (depth == 0 || !lineStart) {
                    depth++;
                }
            } else if (c == '\u201D') {
                depth = Math.max(0, depth - 1);
            } else if (c == '"') {
                if (depth == 0) {
                    depth = 1;
                } else if (!lineStart) {
                    depth--;
                }
            }
        }
        depths[limit - start] = depth;
        return depths;
    }

    private boolean isLineStart(String text, int windowStart, int pos) {
        for (int i = pos - 1; i >= windowStart; i--) {
            char c = text.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '\r') {
                return false;
            }
        }
        return false;
    }
}
