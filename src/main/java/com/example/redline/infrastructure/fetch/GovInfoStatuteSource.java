package com.example.redline.infrastructure.fetch;

import com.example.redline.application.StatuteFetchException;
import com.example.redline.application.StatuteSource;
import com.example.redline.domain.FetchFailureKind;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.StatuteKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * United States Code sections from the GovInfo link service. Only the operative text between the
 * statute field markers is kept; source credits and notes that follow it are dropped.
 */
@Component
public class GovInfoStatuteSource implements StatuteSource {
    private static final Logger log = LogManager.getLogger(GovInfoStatuteSource.class);

    static final String FIELD_START = "<!-- field-start:statute -->";
    static final String FIELD_END = "<!-- field-end:statute -->";

    private final RestClient restClient;
    private final String baseUrl;
    private final String apiKey;
    private final Clock clock;

    public GovInfoStatuteSource(
            RestClient.Builder restClientBuilder,
            @Value("${redline.govinfo.base-url:https://www.govinfo.gov}") String baseUrl,
            @Value("${redline.govinfo.api-key:}") String apiKey,
            Clock clock) {
        this.restClient = restClientBuilder.build();
        this.baseUrl = baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.clock = clock;
    }

    @Override
    public FetchedStatute fetch(StatuteKey key) {
        URI uri = linkUri(key, apiKey);
        String html;
        try {
            html =
                    restClient
                            .get()
                            .uri(uri)
                            .exchange((request, response) -> StatuteResponses.bodyOf(response, key, clock));
        } catch (RestClientException ex) {
            throw new StatuteFetchException(
                    FetchFailureKind.TRANSPORT, "Could not reach GovInfo for " + key + ": " + ex.getMessage(), ex);
        }
        FetchedStatute statute = parse(html, linkUri(key, "").toString());
        if (statute.text().isBlank()) {
            throw new StatuteFetchException(
                    FetchFailureKind.NOT_FOUND, "No statute text in GovInfo response for " + key);
        }
        log.info("Fetched {} from GovInfo", key);
        return statute;
    }

    FetchedStatute parse(String html, String sourceUrl) {
        Document document = Jsoup.parse(html);
        Element heading = document.selectFirst("h3.section-head");
        int start = html.indexOf(FIELD_START);
        int end = html.indexOf(FIELD_END);
        String text;
        if (start >= 0 && end > start) {
            text = format(Jsoup.parseBodyFragment(html.substring(start + FIELD_START.length(), end)));
        } else {
            log.debug("Statute field markers missing in {}, using class-based extraction", sourceUrl);
            text = fallback(document);
        }
        return new FetchedStatute(heading == null ? "" : heading.text(), text, sourceUrl, clock.instant());
    }

    URI linkUri(StatuteKey key, String credential) {
        UriComponentsBuilder builder =
                UriComponentsBuilder.fromHttpUrl(baseUrl)
                        .path("/link/uscode/{title}/{section}")
                        .queryParam("link-type", "html")
                        .queryParam("year", "mostrecent");
        if (!credential.isEmpty()) {
            builder.queryParam("api_key", credential);
        }
        return builder.buildAndExpand(key.title(), key.section()).encode().toUri();
    }

    /** One line per heading or body paragraph, indented by structural depth. */
    private String format(Document fragment) {
        List<String> lines = new ArrayList<>();
        for (Element element : fragment.select("h4, p")) {
            String text = element.text().strip();
            if (text.isEmpty()) {
                continue;
            }
            String classes = element.className();
            if (classes.contains("subsection-head")) {
                lines.add("");
                lines.add(text);
            } else if (classes.contains("paragraph-head") && !classes.contains("subparagraph-head")) {
                lines.add("");
                lines.add("    " + text);
            } else if (classes.contains("subparagraph-head")) {
                lines.add("");
                lines.add("        " + text);
            } else if (classes.contains("statutory-body") && classes.contains("3em")) {
                lines.add("            " + text);
            } else if (classes.contains("statutory-body") && classes.contains("2em")) {
                lines.add("        " + text);
            } else {
                lines.add("    " + text);
            }
        }
        return String.join("\n", lines).strip();
    }

    private String fallback(Document document) {
        List<String> parts = new ArrayList<>();
        for (Element element : document.select(".subsection-head, .paragraph-head, .statutory-body")) {
            String text = element.text().strip();
            if (text.length() > 10) {
                parts.add(text);
            }
        }
        return String.join("\n\n", parts);
    }
}
