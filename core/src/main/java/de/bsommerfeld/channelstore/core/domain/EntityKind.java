package de.bsommerfeld.channelstore.core.domain;

/**
 * The three levels of the configuration hierarchy. Each kind knows its table
 * and, for non-root kinds, the parent kind plus the column holding the
 * parent's id. Callers dispatch on this enum instead of inspecting row shapes.
 */
public enum EntityKind {

    CHANNEL("Channel", "channels", null, null),
    SOURCE("Source", "sources", CHANNEL, "channel_id"),
    SITE("Site", "sites", SOURCE, "parent_id");

    private final String label;
    private final String table;
    private final EntityKind parent;
    private final String parentColumn;

    EntityKind(String label, String table, EntityKind parent, String parentColumn) {
        this.label = label;
        this.table = table;
        this.parent = parent;
        this.parentColumn = parentColumn;
    }

    public String label() {
        return label;
    }

    public String table() {
        return table;
    }

    /** @return the owning kind, or {@code null} for {@link #CHANNEL} */
    public EntityKind parent() {
        return parent;
    }

    public String parentColumn() {
        return parentColumn;
    }

    public boolean isRoot() {
        return parent == null;
    }
}
