package com.example.redline.application.detect;

import com.example.redline.domain.Citation;
import com.example.redline.domain.CitationType;
import com.example.redline.domain.StructuralAddress;
import com.example.redline.domain.StructuralLabel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds USC, CFR and Public Law references in document text. Offsets refer to the text as given.
 */
@Service
public class CitationDetector {
    private static final Logger log = LogManager.getLogger(CitationDetector.class);

    private static final String SECTION = "(\\d+[A-Za-z0-9]*(?:-\\d+[A-Za-z]?)?)";
    private static final String LABELS = "((?:\\([A-Za-z0-9]{1,6}\\))*)";
    private static final Pattern LABEL = Pattern.compile("\\(([A-Za-z0-9]{1,6})\\)");

    private static final Pattern USC_ABBREVIATED =
            Pattern.compile(
                    "\\b(\\d+)\\s+U\\.?\\s?S\\.?\\s?C\\.?\\s*(?:§{1,2}\\s*|sec\\.\\s*)?" + SECTION + LABELS,
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern USC_TITLE_SECTION =
            Pattern.compile(
                    "\\bTitle\\s+(\\d+)\\s*,\\s*Section\\s+" + SECTION + LABELS,
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern USC_SECTION_OF_TITLE =
            Pattern.compile(
                    "\\bsection\\s+" + SECTION + LABELS + "\\s+of\\s+title\\s+(\\d+)(?:\\s*,\\s*United\\s+States\\s+Code)?",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern CFR =
            Pattern.compile(
                    "\\b(\\d+)\\s+C\\.?\\s?F\\.?\\s?R\\.?\\s*(?:§{1,2}\\s*|part\\s+)?(\\d+(?:\\.\\d+[a-z]?)?)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern PUBLIC_LAW =
            Pattern.compile(
                    "\\b(?:Pub\\.\\s*L\\.|Public\\s+Law)\\s*(?:No\\.\\s*)?(\\d+)\\s*[-\\u2010\\u2011\\u2013]\\s*(\\d+)",
                    Pattern.CASE_INSENSITIVE);

    private static final Pattern DEFINITIONAL_LEAD =
            Pattern.compile(
                    "(?:has\\s+the\\s+meaning\\s+given(?:\\s+(?:such|that|the)\\s+terms?)?(?:\\s+in)?"
                            + "|the\\s+meaning\\s+given\\s+(?:such|that|the)\\s+terms?\\s+in"
                            + "|as\\s+defined\\s+(?:in|under|by)"
                            + "|within\\s+the\\s+meaning\\s+of"
                            + "|defined\\s+in)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFINITIONAL_TRAIL =
            Pattern.compile("^\\s*\\((?:relating\\s+to|defining)\\s+[^)]*definitions?[^)]*\\)", Pattern.CASE_INSENSITIVE);

    private static final int MAX_LEAD_CHARS = 400;
    private static final int MAX_TRAIL_CHARS = 200;

    private final int definitionalWindowTokens;

    public CitationDetector(
            @Value("${redline.detection.definitional-window-tokens:8}") int definitionalWindowTokens) {
        this.definitionalWindowTokens = Math.max(1, definitionalWindowTokens);
    }

    public List<Citation> detect(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        collect(candidates, USC_ABBREVIATED.matcher(text), CitationType.USC, 1, 2, 3);
        collect(candidates, USC_TITLE_SECTION.matcher(text), CitationType.USC, 1, 2, 3);
        collect(candidates, USC_SECTION_OF_TITLE.matcher(text), CitationType.USC, 3, 1, 2);
        collect(candidates, CFR.matcher(text), CitationType.CFR, 1, 2, 0);
        collect(candidates, PUBLIC_LAW.matcher(text), CitationType.PUBLAW, 1, 2, 0);

        TreeMap<Integer, Candidate> accepted = new TreeMap<>();
        candidates.sort(
                Comparator.comparingInt((Candidate c) -> c.end - c.start)
                        .reversed()
                        .thenComparingInt(c -> c.type.ordinal())
                        .thenComparingInt(c -> c.start));
        for (Candidate candidate : candidates) {
            // accepted spans are disjoint, so only the last one starting before this end can overlap
            Map.Entry<Integer, Candidate> nearest = accepted.lowerEntry(candidate.end);
            if (nearest == null || !nearest.getValue().overlaps(candidate)) {
                accepted.put(candidate.start, candidate);
            }
        }

        List<Citation> citations = new ArrayList<>(accepted.size());
        for (Candidate candidate : accepted.values()) {
            citations.add(
                    Citation.detected(
                            citations.size() + 1,
                            candidate.type,
                            candidate.address,
                            text.substring(candidate.start, candidate.end),
                            candidate.start,
                            candidate.end,
                            isDefinitional(text, candidate.start, candidate.end)));
        }
        log.debug("Detected {} citations in {} characters", citations.size(), text.length());
        return citations;
    }

    boolean isDefinitional(String text, int start, int end) {
        if (DEFINITIONAL_LEAD.matcher(leadWindow(text, start)).find()) {
            return true;
        }
        Matcher trail = DEFINITIONAL_TRAIL.matcher(text);
        trail.region(end, Math.min(text.length(), end + MAX_TRAIL_CHARS));
        return trail.find();
    }

    /** The last {@code definitionalWindowTokens} whitespace-separated tokens before {@code start}. */
    private String leadWindow(String text, int start) {
        int floor = Math.max(0, start - MAX_LEAD_CHARS);
        int from = start;
        int tokens = 0;
        int i = start;
        while (i > floor && tokens < definitionalWindowTokens) {
            while (i > floor && Character.isWhitespace(text.charAt(i - 1))) {
                i--;
            }
            if (i == floor) {
                break;
            }
            while (i > floor && !Character.isWhitespace(text.charAt(i - 1))) {
                i--;
            }
            tokens++;
            from = i;
        }
        return text.substring(from, start).strip().replaceAll("\\s+", " ");
    }

    private void collect(
            List<Candidate> candidates,
            Matcher matcher,
            CitationType type,
            int titleGroup,
            int sectionGroup,
            int labelsGroup) {
        while (matcher.find()) {
            String section = matcher.group(sectionGroup);
            if (section == null || section.chars().noneMatch(Character::isDigit)) {
                continue;
            }
            int title;
            try {
                title = Integer.parseInt(matcher.group(titleGroup));
            } catch (NumberFormatException ex) {
                continue;
            }
            List<StructuralLabel> path = List.of();
            int end = matcher.end();
            if (labelsGroup > 0 && matcher.group(labelsGroup) != null) {
                List<String> raw = new ArrayList<>();
                Matcher label = LABEL.matcher(matcher.group(labelsGroup));
                while (label.find()) {
                    raw.add(label.group(1));
                }
                path = StructuralLabel.typePath(raw);
            }
            candidates.add(
                    new Candidate(
                            type, new StructuralAddress(title, section, path), matcher.start(), end));
        }
    }

    private record Candidate(CitationType type, StructuralAddress address, int start, int end) {
        boolean overlaps(Candidate other) {
            return start < other.end && other.start < end;
        }
    }
}
