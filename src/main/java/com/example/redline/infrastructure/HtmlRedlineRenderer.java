package com.example.redline.infrastructure;

import com.example.redline.application.RedlineRenderer;
import com.example.redline.domain.AmendmentKind;
import com.example.redline.domain.EditOperation;
import com.example.redline.domain.EditScript;
import com.example.redline.domain.EditSpan;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Renders an edit script as HTML. Source text is escaped before it is wrapped, so only the redline
 * markers themselves are markup.
 */
@Component
public class HtmlRedlineRenderer implements RedlineRenderer {
    private static final String NO_CHANGES_MESSAGE = "No changes detected between the original and amended text.";
    private static final String ELLIPSIS = "<span class=\"redline-ellipsis\">…</span>";

    private final int contextWords;

    public HtmlRedlineRenderer(@Value("${redline.render.context-words:8}") int contextWords) {
        this.contextWords = Math.max(0, contextWords);
    }

    @Override
    public Redline render(EditScript script, AmendmentKind kind) {
        boolean changed = script.hasChanges();
        StringBuilder inline = new StringBuilder();
        inline.append("<div class=\"redline-container\" data-amendment-kind=\"")
                .append(kind.code())
                .append("\">");
        if (!changed) {
            inline.append("<p class=\"redline-note\">").append(NO_CHANGES_MESSAGE).append("</p>");
        }
        inline.append(spans(script.spans())).append("</div>");
        String condensed =
                changed
                        ? condensed(script.spans())
                        : "<p class=\"redline-note\">" + NO_CHANGES_MESSAGE + "</p>";
        return new Redline(
                inline.toString(), spans(script.originalSide()), spans(script.amendedSide()), condensed);
    }

    private String spans(List<EditSpan> spans) {
        StringBuilder sb = new StringBuilder();
        for (EditSpan span : spans) {
            sb.append(span(span.operation(), span.text()));
        }
        return sb.toString();
    }

    private String span(EditOperation operation, String text) {
        String escaped = HtmlUtils.htmlEscape(text);
        return switch (operation) {
            case UNCHANGED -> escaped;
            case DELETED -> "<del class=\"redline-deleted\">" + escaped + "</del>";
            case INSERTED -> "<ins class=\"redline-inserted\">" + escaped + "</ins>";
        };
    }

    /** Changes with a few words of context on each side; longer unchanged runs are elided. */
    private String condensed(List<EditSpan> spans) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < spans.size(); i++) {
            EditSpan span = spans.get(i);
            if (span.operation() != EditOperation.UNCHANGED) {
                sb.append(span(span.operation(), span.text()));
                continue;
            }
            List<String> words = Arrays.asList(span.text().split("(?<=\\s)(?=\\S)"));
            boolean before = i > 0;
            boolean after = i < spans.size() - 1;
            int keep = (before ? contextWords : 0) + (after ? contextWords : 0);
            if (words.size() <= keep) {
                sb.append(HtmlUtils.htmlEscape(span.text()));
                continue;
            }
            if (before) {
                sb.append(HtmlUtils.htmlEscape(String.join("", words.subList(0, contextWords))));
            }
            sb.append(ELLIPSIS);
            if (after) {
                sb.append(HtmlUtils.htmlEscape(String.join("", words.subList(words.size() - contextWords, words.size()))));
            }
        }
        return sb.toString();
    }
}
