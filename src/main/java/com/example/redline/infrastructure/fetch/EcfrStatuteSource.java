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

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Code of Federal Regulations sections from eCFR. While federal operations are suspended eCFR
 * redirects to an unblock page; that is reported as a transport failure so the fetch is retried.
 */
@Component
public class EcfrStatuteSource implements StatuteSource {
    private static final Logger log = LogManager.getLogger(EcfrStatuteSource.class);

    static final String UNBLOCK_HOST = "unblock.federalregister.gov";
    private static final String[] CONTENT_SELECTORS = {
        "div.section-content", "div[data-section]", "div.ecfr-content", "article", "main"
    };
    private static final int MIN_PARAGRAPH_LENGTH = 20;

    private final RestClient restClient;
    private final String baseUrl;
    private final Clock clock;

    public EcfrStatuteSource(
            RestClient.Builder restClientBuilder,
            @Value("${redline.ecfr.base-url:https://www.ecfr.gov}") String baseUrl,
            Clock clock) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
        this.baseUrl = baseUrl;
        this.clock = clock;
    }

    @Override
    public FetchedStatute fetch(StatuteKey key) {
        String path = "/current/title-" + key.title() + "/section-" + key.section();
        String html;
        try {
            html =
                    restClient
                            .get()
                            .uri(path)
                            .exchange(
                                    (request, response) -> {
                                        if (response.getStatusCode().is3xxRedirection()) {
                                            String location = response.getHeaders().getFirst("Location");
                                            throw new StatuteFetchException(
                                                    FetchFailureKind.TRANSPORT,
                                                    location != null && location.contains(UNBLOCK_HOST)
                                                            ? "eCFR is currently unavailable"
                                                            : "Unexpected redirect while fetching " + key);
                                        }
                                        return StatuteResponses.bodyOf(response, key, clock);
                                    });
        } catch (RestClientException ex) {
            throw new StatuteFetchException(
                    FetchFailureKind.TRANSPORT, "Could not reach eCFR for " + key + ": " + ex.getMessage(), ex);
        }
        if (html.contains(UNBLOCK_HOST)) {
            throw new StatuteFetchException(FetchFailureKind.TRANSPORT, "eCFR is currently unavailable");
        }
        FetchedStatute statute = parse(html, baseUrl + path);
        if (statute.text().isBlank()) {
            throw new StatuteFetchException(
                    FetchFailureKind.NOT_FOUND, "No regulation text in eCFR response for " + key);
        }
        log.info("Fetched {} from eCFR", key);
        return statute;
    }

    FetchedStatute parse(String html, String sourceUrl) {
        Document document = Jsoup.parse(html);
        Element heading = document.selectFirst("h1.section-head");
        if (heading == null) {
            heading = document.selectFirst("h1");
        }
        Element content = null;
        for (String selector : CONTENT_SELECTORS) {
            content = document.selectFirst(selector);
            if (content != null) {
                break;
            }
        }
        if (content == null) {
            content = document.body();
        }
        // nested divs repeat their children's text
        Set<String> paragraphs = new LinkedHashSet<>();
        for (Element element : content.select("p, div")) {
            if (element == content) {
                continue;
            }
            String classes = element.className();
            if (classes.contains("nav") || classes.contains("meta")
                    || classes.contains("header") || classes.contains("footer")) {
                continue;
            }
            String text = element.text().strip();
            if (text.length() > MIN_PARAGRAPH_LENGTH) {
                paragraphs.add(text);
            }
        }
        return new FetchedStatute(
                heading == null ? "" : heading.text(),
                String.join("\n\n", paragraphs),
                sourceUrl,
                clock.instant());
    }
}
