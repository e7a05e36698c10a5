package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.domain.EntityKind;
import de.bsommerfeld.channelstore.core.domain.Site;
import de.bsommerfeld.channelstore.core.domain.SiteType;
import de.bsommerfeld.channelstore.core.event.ApplicationEventBus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Sites hang off a source via {@code parent_id}. The site type is written as
 * its literal name and the table's CHECK constraint rejects anything else.
 */
public class SiteRepository extends AbstractSqlRepository<Site> {

    public SiteRepository(Connection connection, ApplicationEventBus eventBus) {
        super(connection, eventBus, EntityKind.SITE);
    }

    @Override
    protected void validate(Site site) {
        requireText(site.siteUrl(), "site_url");
        requirePresent(site.siteType(), "site_type");
    }

    @Override
    protected Long parentId(Site site) {
        return site.sourceId();
    }

    @Override
    protected int bind(PreparedStatement ps, Site s) throws SQLException {
        ps.setLong(1, s.sourceId());
        ps.setString(2, s.siteUrl());
        ps.setString(3, s.siteType().name());
        return 4;
    }

    @Override
    protected Site map(ResultSet rs) throws SQLException {
        return new Site(
                rs.getLong("id"), rs.getLong("parent_id"), rs.getString("site_url"),
                SiteType.parse(rs.getString("site_type")));
    }
}
