package de.bsommerfeld.channelstore.core.domain;

/**
 * A pollable endpoint owned by exactly one {@link Source}.
 *
 * @param id       storage identity, {@code null} before insert
 * @param sourceId id of the owning source
 * @param siteUrl  endpoint URL
 * @param siteType listing category
 */
public record Site(
        Long id,
        long sourceId,
        String siteUrl,
        SiteType siteType) implements Identified {

    public static Site draft(long sourceId, String siteUrl, SiteType siteType) {
        return new Site(null, sourceId, siteUrl, siteType);
    }

    public Site withId(long newId) {
        return new Site(newId, sourceId, siteUrl, siteType);
    }
}
