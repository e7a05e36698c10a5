package de.bsommerfeld.channelstore.core.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves which words block a post coming from a given source.
 *
 * <p>
 * Channel and source both carry a word list. The effective filter is their
 * union: channel words first, then the source's additions in their own order.
 * A source can extend the channel filter but cannot lift a channel word.
 * Matching is case-sensitive, the words are taken exactly as stored.
 */
public final class ForbiddenWords {

    private ForbiddenWords() {
    }

    /**
     * @throws IllegalArgumentException if the source does not belong to the
     *                                  channel
     */
    public static Set<String> effective(Channel channel, Source source) {
        if (channel.id() == null || channel.id() != source.channelId()) {
            throw new IllegalArgumentException("Source " + source.id()
                    + " does not belong to channel " + channel.id());
        }
        Set<String> merged = new LinkedHashSet<>(channel.forbiddenWords());
        merged.addAll(source.forbiddenWords());
        return Collections.unmodifiableSet(merged);
    }

    /**
     * Returns the first effective word contained in {@code text}, or
     * {@code null} when the text passes the filter.
     */
    public static String firstMatch(Set<String> words, String text) {
        if (text == null || text.isEmpty())
            return null;
        for (String word : words) {
            if (!word.isEmpty() && text.contains(word))
                return word;
        }
        return null;
    }
}
