package com.example.redline.infrastructure.fetch;

import com.example.redline.application.StatuteFetchException;
import com.example.redline.domain.FetchFailureKind;
import com.example.redline.domain.StatuteKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Status handling shared by the HTTP statute sources. */
final class StatuteResponses {
    private static final Logger log = LogManager.getLogger(StatuteResponses.class);

    static final String RETRY_AFTER = "Retry-After";
    static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";

    private StatuteResponses() {}

    /**
     * Returns the body of a successful response, or throws the typed failure the status maps to.
     */
    static String bodyOf(ClientHttpResponse response, StatuteKey key, Clock clock) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        if (status.value() == 404 || status.value() == 410) {
            throw new StatuteFetchException(FetchFailureKind.NOT_FOUND, "Section not found: " + key);
        }
        if (status.value() == 429) {
            throw new StatuteFetchException(
                    FetchFailureKind.RATE_LIMITED,
                    "Rate limited while fetching " + key,
                    resetHint(response.getHeaders(), clock));
        }
        if (!status.is2xxSuccessful()) {
            throw new StatuteFetchException(
                    FetchFailureKind.TRANSPORT, "HTTP " + status.value() + " while fetching " + key);
        }
        MediaType contentType = response.getHeaders().getContentType();
        Charset charset =
                contentType != null && contentType.getCharset() != null
                        ? contentType.getCharset()
                        : StandardCharsets.UTF_8;
        return new String(response.getBody().readAllBytes(), charset);
    }

    /**
     * Delay requested by a rate-limit response: {@code Retry-After} as seconds or an HTTP date,
     * otherwise {@code X-RateLimit-Reset} as epoch seconds. {@code null} when neither is usable.
     */
    static Duration resetHint(HttpHeaders headers, Clock clock) {
        String retryAfter = headers.getFirst(RETRY_AFTER);
        if (retryAfter != null && !retryAfter.isBlank()) {
            String value = retryAfter.trim();
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            try {
                Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                return nonNegative(Duration.between(clock.instant(), at));
            } catch (DateTimeParseException ex) {
                log.debug("Ignoring unparseable {} header '{}'", RETRY_AFTER, value);
            }
        }
        String reset = headers.getFirst(RATE_LIMIT_RESET);
        if (reset != null && !reset.isBlank() && reset.trim().chars().allMatch(Character::isDigit)) {
            Instant at = Instant.ofEpochSecond(Long.parseLong(reset.trim()));
            return nonNegative(Duration.between(clock.instant(), at));
        }
        return null;
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }
}
