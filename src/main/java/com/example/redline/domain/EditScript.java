package com.example.redline.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered spans tagged unchanged, deleted or inserted. Adjacent spans never share a tag, and every
 * rendered view of a comparison is a projection of one script.
 */
public record EditScript(List<EditSpan> spans) {
    public EditScript {
        spans = spans == null ? List.of() : List.copyOf(spans);
    }

    public static EditScript unchanged(String text) {
        return new EditScript(List.of(new EditSpan(EditOperation.UNCHANGED, text)));
    }

    public boolean hasChanges() {
        return spans.stream().anyMatch(span -> span.operation() != EditOperation.UNCHANGED);
    }

    /** Unchanged and deleted spans, in order. */
    public List<EditSpan> originalSide() {
        return spans.stream().filter(span -> span.operation() != EditOperation.INSERTED).toList();
    }

    /** Unchanged and inserted spans, in order. */
    public List<EditSpan> amendedSide() {
        return spans.stream().filter(span -> span.operation() != EditOperation.DELETED).toList();
    }

    public String originalText() {
        return join(originalSide());
    }

    public String amendedText() {
        return join(amendedSide());
    }

    public int wordCount(EditOperation operation) {
        int count = 0;
        for (EditSpan span : spans) {
            if (span.operation() == operation) {
                for (String word : span.text().trim().split("\\s+")) {
                    if (!word.isEmpty()) {
                        count++;
                    }
                }
            }
        }
        return count;
    }

    /** Collects spans, merging a span into its predecessor when both carry the same tag. */
    public static final class Builder {
        private final List<EditSpan> spans = new ArrayList<>();

        public Builder add(EditOperation operation, String text) {
            if (text == null || text.isEmpty()) {
                return this;
            }
            int last = spans.size() - 1;
            if (last >= 0 && spans.get(last).operation() == operation) {
                spans.set(last, spans.get(last).append(text));
            } else {
                spans.add(new EditSpan(operation, text));
            }
            return this;
        }

        public EditScript build() {
            return new EditScript(spans);
        }
    }

    private static String join(List<EditSpan> parts) {
        StringBuilder sb = new StringBuilder();
        for (EditSpan span : parts) {
            sb.append(span.text());
        }
        return sb.toString();
    }
}
