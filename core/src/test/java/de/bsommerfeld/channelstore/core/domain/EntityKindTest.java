package de.bsommerfeld.channelstore.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityKindTest {

    @Test
    void channel_shouldBeTheOnlyRoot() {
        assertTrue(EntityKind.CHANNEL.isRoot());
        assertFalse(EntityKind.SOURCE.isRoot());
        assertFalse(EntityKind.SITE.isRoot());
    }

    @Test
    void parentChain_shouldRunSiteToSourceToChannel() {
        assertEquals(EntityKind.SOURCE, EntityKind.SITE.parent());
        assertEquals(EntityKind.CHANNEL, EntityKind.SOURCE.parent());
        assertNull(EntityKind.CHANNEL.parent());
    }

    @Test
    void parentColumns_shouldMatchSchema() {
        assertEquals("channel_id", EntityKind.SOURCE.parentColumn());
        assertEquals("parent_id", EntityKind.SITE.parentColumn());
        assertNull(EntityKind.CHANNEL.parentColumn());
    }

    @Test
    void tables_shouldBePluralNames() {
        assertEquals("channels", EntityKind.CHANNEL.table());
        assertEquals("sources", EntityKind.SOURCE.table());
        assertEquals("sites", EntityKind.SITE.table());
    }
}
