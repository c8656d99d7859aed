package com.example.redline.application;

import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.StatuteKey;

/**
 * Supplies the current authoritative text of a statute section.
 *
 * @throws StatuteFetchException when the section cannot be retrieved
 */
public interface StatuteSource {
    FetchedStatute fetch(StatuteKey key);
}
