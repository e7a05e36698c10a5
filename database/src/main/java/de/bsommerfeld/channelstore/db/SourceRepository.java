package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.domain.EntityKind;
import de.bsommerfeld.channelstore.core.domain.Source;
import de.bsommerfeld.channelstore.core.event.ApplicationEventBus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Sources hang off a channel via {@code channel_id}. {@code parse_media} is
 * stored as 0/1.
 */
public class SourceRepository extends AbstractSqlRepository<Source> {

    public SourceRepository(Connection connection, ApplicationEventBus eventBus) {
        super(connection, eventBus, EntityKind.SOURCE);
    }

    @Override
    protected void validate(Source source) {
        requireText(source.sourceUrl(), "source_url");
    }

    @Override
    protected Long parentId(Source source) {
        return source.channelId();
    }

    @Override
    protected int bind(PreparedStatement ps, Source s) throws SQLException {
        ps.setLong(1, s.channelId());
        ps.setString(2, s.sourceUrl());
        ps.setInt(3, FieldCodec.encodeBoolean(s.parseMedia()));
        ps.setString(4, FieldCodec.encodeList(s.forbiddenWords()));
        return 5;
    }

    @Override
    protected Source map(ResultSet rs) throws SQLException {
        return new Source(
                rs.getLong("id"), rs.getLong("channel_id"), rs.getString("source_url"),
                FieldCodec.decodeBoolean(rs.getInt("parse_media")),
                FieldCodec.decodeSet(rs.getString("forbidden_words")));
    }
}
