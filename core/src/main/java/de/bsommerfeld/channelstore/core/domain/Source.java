package de.bsommerfeld.channelstore.core.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A scrape target owned by exactly one {@link Channel}.
 *
 * @param id             storage identity, {@code null} before insert
 * @param channelId      id of the owning channel
 * @param sourceUrl      URL to scrape
 * @param parseMedia     whether media attachments are extracted as well
 * @param forbiddenWords source-level additions to the channel's word filter
 * @see ForbiddenWords#effective(Channel, Source)
 */
public record Source(
        Long id,
        long channelId,
        String sourceUrl,
        boolean parseMedia,
        Set<String> forbiddenWords) implements Identified {

    public Source {
        forbiddenWords = forbiddenWords != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(forbiddenWords))
                : Collections.emptySet();
    }

    public static Source draft(long channelId, String sourceUrl, boolean parseMedia,
            Iterable<String> forbiddenWords) {
        return new Source(null, channelId, sourceUrl, parseMedia, Channel.toSet(forbiddenWords));
    }

    public Source withId(long newId) {
        return new Source(newId, channelId, sourceUrl, parseMedia, forbiddenWords);
    }
}
