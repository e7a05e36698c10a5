package de.bsommerfeld.channelstore.core.event;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

/**
 * Posted on the {@link ApplicationEventBus} after a mutation has committed.
 * Front ends listen to these to refresh their views.
 */
public final class StoreEvents {

    private StoreEvents() {
    }

    public record EntityCreated(EntityKind kind, long id) {
    }

    public record EntityUpdated(EntityKind kind, long id) {
    }

    /**
     * Only the explicitly deleted row is reported. Children removed by the
     * cascade are not announced one by one.
     */
    public record EntityDeleted(EntityKind kind, long id) {
    }
}
