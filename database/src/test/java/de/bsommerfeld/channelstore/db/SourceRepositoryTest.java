package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.domain.Channel;
import de.bsommerfeld.channelstore.core.domain.EntityKind;
import de.bsommerfeld.channelstore.core.domain.Source;
import de.bsommerfeld.channelstore.core.error.ForeignKeyException;
import de.bsommerfeld.channelstore.core.error.NotFoundException;
import de.bsommerfeld.channelstore.core.error.RequiredFieldException;
import de.bsommerfeld.channelstore.core.event.ApplicationEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SourceRepositoryTest {

    @TempDir
    Path tempDir;

    private SchemaManager schema;
    private ConfigStore store;
    private SourceRepository sources;
    private long channelId;

    @BeforeEach
    void setUp() {
        schema = SchemaManager.open(tempDir.resolve("test.db"), 1000);
        schema.ensureSchema();
        store = new ConfigStore(schema, new ApplicationEventBus());
        sources = store.sources();
        channelId = store.channels().create(Channel.draft("news", "https://x", List.of(), List.of()));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void create_shouldPersistAndDecodeAllFields() {
        long id = sources.create(Source.draft(channelId, "https://feed", true, List.of("ads", "spam")));

        Source loaded = sources.get(id);
        assertNotNull(loaded);
        assertEquals(channelId, loaded.channelId());
        assertEquals("https://feed", loaded.sourceUrl());
        assertTrue(loaded.parseMedia());
        assertEquals(List.of("ads", "spam"), List.copyOf(loaded.forbiddenWords()));
    }

    @Test
    void parseMedia_shouldRoundTripBothValues() {
        long on = sources.create(Source.draft(channelId, "https://a", true, List.of()));
        long off = sources.create(Source.draft(channelId, "https://b", false, List.of()));

        assertTrue(sources.get(on).parseMedia());
        assertFalse(sources.get(off).parseMedia());
    }

    @Test
    void parseMedia_shouldBeStoredAsSmallInteger() throws Exception {
        long id = sources.create(Source.draft(channelId, "https://a", true, List.of()));

        try (Statement stmt = schema.connection().createStatement();
                ResultSet rs = stmt.executeQuery("SELECT parse_media FROM sources WHERE id = " + id)) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
        }
    }

    @Test
    void list_shouldDecodeAnyNonzeroParseMediaAsTrue() throws Exception {
        try (Statement stmt = schema.connection().createStatement()) {
            stmt.execute("INSERT INTO sources (channel_id, source_url, parse_media, forbidden_words) VALUES ("
                    + channelId + ", 'https://legacy', 5, NULL)");
        }

        Source legacy = sources.list().get(0);
        assertTrue(legacy.parseMedia());
        assertTrue(legacy.forbiddenWords().isEmpty());
    }

    @Test
    void create_shouldRejectMissingChannelWithoutInserting() {
        ForeignKeyException e = assertThrows(ForeignKeyException.class,
                () -> sources.create(Source.draft(4242, "https://feed", false, List.of())));

        assertEquals(4242L, e.parentId());
        assertEquals(EntityKind.CHANNEL, e.parentKind());
        assertEquals(EntityKind.SOURCE, e.kind());
        assertTrue(sources.list().isEmpty());
    }

    @Test
    void create_shouldRejectBlankUrl() {
        RequiredFieldException e = assertThrows(RequiredFieldException.class,
                () -> sources.create(Source.draft(channelId, "", false, List.of())));

        assertEquals("source_url", e.field());
    }

    @Test
    void update_shouldMoveSourceToAnotherChannel() {
        long other = store.channels().create(Channel.draft("sport", "https://y", List.of(), List.of()));
        long id = sources.create(Source.draft(channelId, "https://feed", false, List.of("a")));

        sources.update(id, Source.draft(other, "https://feed2", true, List.of()));

        Source loaded = sources.get(id);
        assertEquals(other, loaded.channelId());
        assertEquals("https://feed2", loaded.sourceUrl());
        assertTrue(loaded.parseMedia());
        assertEquals(Set.of(), loaded.forbiddenWords());
    }

    @Test
    void update_shouldRejectMissingChannelAndLeaveRowUnchanged() {
        long id = sources.create(Source.draft(channelId, "https://feed", false, List.of()));

        assertThrows(ForeignKeyException.class,
                () -> sources.update(id, Source.draft(777, "https://moved", false, List.of())));

        Source loaded = sources.get(id);
        assertEquals(channelId, loaded.channelId());
        assertEquals("https://feed", loaded.sourceUrl());
    }

    @Test
    void update_shouldPreferNotFoundOverForeignKey() {
        assertThrows(NotFoundException.class,
                () -> sources.update(999, Source.draft(777, "https://ghost", false, List.of())));
    }

    @Test
    void delete_shouldRemoveOnlyTheSource() {
        long keep = sources.create(Source.draft(channelId, "https://keep", false, List.of()));
        long drop = sources.create(Source.draft(channelId, "https://drop", false, List.of()));

        sources.delete(drop);

        assertEquals(List.of(keep), sources.list().stream().map(Source::id).toList());
        assertEquals(1, store.channels().list().size());
    }
}
