package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.domain.Channel;
import de.bsommerfeld.channelstore.core.domain.EntityKind;
import de.bsommerfeld.channelstore.core.event.ApplicationEventBus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Root level of the hierarchy. {@code name} and {@code url} are unique across
 * all channels; deleting a channel removes its sources and their sites.
 */
public class ChannelRepository extends AbstractSqlRepository<Channel> {

    public ChannelRepository(Connection connection, ApplicationEventBus eventBus) {
        super(connection, eventBus, EntityKind.CHANNEL);
    }

    @Override
    protected void validate(Channel channel) {
        requireText(channel.name(), "name");
        requireText(channel.url(), "url");
    }

    @Override
    protected Long parentId(Channel channel) {
        return null;
    }

    @Override
    protected int bind(PreparedStatement ps, Channel c) throws SQLException {
        ps.setString(1, c.name());
        ps.setString(2, c.url());
        ps.setString(3, FieldCodec.encodeList(c.postTimes()));
        ps.setString(4, FieldCodec.encodeList(c.forbiddenWords()));
        return 5;
    }

    @Override
    protected Channel map(ResultSet rs) throws SQLException {
        return new Channel(
                rs.getLong("id"), rs.getString("name"), rs.getString("url"),
                FieldCodec.decodeList(rs.getString("post_times")),
                FieldCodec.decodeSet(rs.getString("forbidden_words")));
    }
}
