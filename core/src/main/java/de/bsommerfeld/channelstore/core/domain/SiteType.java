package de.bsommerfeld.channelstore.core.domain;

import de.bsommerfeld.channelstore.core.error.InvalidEnumException;

/**
 * Listing category of a {@link Site}. The same four literals are enforced by
 * a CHECK constraint on {@code sites.site_type}.
 */
public enum SiteType {

    AUTO,
    RENT,
    BUY,
    FREE;

    /**
     * Resolves the exact literal. No trimming or case folding happens here,
     * anything that is not one of the four names is rejected.
     *
     * @throws InvalidEnumException for {@code null} or unknown values
     */
    public static SiteType parse(String value) {
        if (value != null) {
            for (SiteType type : values()) {
                if (type.name().equals(value))
                    return type;
            }
        }
        throw new InvalidEnumException(EntityKind.SITE, "site_type", value);
    }
}
