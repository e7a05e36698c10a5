package de.bsommerfeld.channelstore.core.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A distribution destination: where scraped content ends up, when it is
 * posted and which words block a post.
 *
 * @param id             storage identity, {@code null} before insert
 * @param name           unique display name
 * @param url            unique destination URL
 * @param postTimes      posting schedule as time strings (e.g. {@code 09:00}),
 *                       order is significant
 * @param forbiddenWords words that block a post, insertion-ordered
 */
public record Channel(
        Long id,
        String name,
        String url,
        List<String> postTimes,
        Set<String> forbiddenWords) implements Identified {

    /**
     * Canonical constructor — null collections become empty, both are copied
     * so the record stays immutable.
     */
    public Channel {
        postTimes = postTimes != null ? List.copyOf(postTimes) : List.of();
        forbiddenWords = forbiddenWords != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(forbiddenWords))
                : Collections.emptySet();
    }

    /**
     * Convenience constructor for a channel that has not been stored yet.
     */
    public static Channel draft(String name, String url, List<String> postTimes,
            Iterable<String> forbiddenWords) {
        return new Channel(null, name, url, postTimes, toSet(forbiddenWords));
    }

    public Channel withId(long newId) {
        return new Channel(newId, name, url, postTimes, forbiddenWords);
    }

    static Set<String> toSet(Iterable<String> words) {
        Set<String> set = new LinkedHashSet<>();
        if (words != null) {
            for (String w : words)
                set.add(w);
        }
        return set;
    }
}
