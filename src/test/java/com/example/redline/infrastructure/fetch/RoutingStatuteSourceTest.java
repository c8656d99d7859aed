package com.example.redline.infrastructure.fetch;

import com.example.redline.application.StatuteFetchException;
import com.example.redline.application.StatuteSource;
import com.example.redline.domain.CitationType;
import com.example.redline.domain.FetchFailureKind;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.StatuteKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoutingStatuteSourceTest {

    @Mock private StatuteSource usc;
    @Mock private StatuteSource cfr;

    @Test
    void routesByCitationType() {
        StatuteKey key = new StatuteKey(CitationType.CFR, 42, "482.12");
        FetchedStatute statute = new FetchedStatute("§ 482.12", "Text.", "https://www.ecfr.gov", Instant.EPOCH);
        when(cfr.fetch(key)).thenReturn(statute);

        assertThat(new RoutingStatuteSource(usc, cfr).fetch(key)).isSameAs(statute);
        verifyNoInteractions(usc);
    }

    @Test
    void publicLawsAreNotFound() {
        StatuteKey key = new StatuteKey(CitationType.PUBLAW, 117, "169");

        assertThatThrownBy(() -> new RoutingStatuteSource(usc, cfr).fetch(key))
                .isInstanceOfSatisfying(
                        StatuteFetchException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(FetchFailureKind.NOT_FOUND))
                .hasMessage("Public Law 117-169 is not available through automated sources");
        verifyNoInteractions(usc, cfr);
    }
}
