package com.example.redline.infrastructure.fetch;

import com.example.redline.application.StatuteFetchException;
import com.example.redline.application.StatuteSource;
import com.example.redline.domain.FetchFailureKind;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.StatuteKey;

/** Sends each citation type to the source that publishes it. */
public class RoutingStatuteSource implements StatuteSource {
    private final StatuteSource usc;
    private final StatuteSource cfr;

    public RoutingStatuteSource(StatuteSource usc, StatuteSource cfr) {
        this.usc = usc;
        this.cfr = cfr;
    }

    @Override
    public FetchedStatute fetch(StatuteKey key) {
        return switch (key.type()) {
            case USC -> usc.fetch(key);
            case CFR -> cfr.fetch(key);
            case PUBLAW -> throw new StatuteFetchException(
                    FetchFailureKind.NOT_FOUND,
                    "Public Law " + key.title() + "-" + key.section()
                            + " is not available through automated sources");
        };
    }
}
