/**
 * SQLite persistence for the channel configuration hierarchy.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Front end / automation]
 *        │
 *        ▼
 *   ConfigStore          ← owns the connection, one repository per kind
 *    ┌───┼────────┐
 *    │   │        │
 * Channel Source  Site   ← EntityRepository, shared AbstractSqlRepository
 *    └───┼────────┘
 *        ▼
 *   SchemaManager        ← open, PRAGMA foreign_keys, schema.sql
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ channels                                                          │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │                                                │
 * │ name  (UQ)       │ display name                                   │
 * │ url   (UQ)       │ destination URL                                │
 * │ post_times       │ JSON array of time strings                     │
 * │ forbidden_words  │ JSON array of words                            │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ sources                                                           │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │                                                │
 * │ channel_id       │ FK → channels.id ON DELETE CASCADE             │
 * │ source_url       │ scrape target                                  │
 * │ parse_media      │ 0 / 1                                          │
 * │ forbidden_words  │ JSON array of words                            │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ sites                                                             │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │                                                │
 * │ parent_id        │ FK → sources.id ON DELETE CASCADE              │
 * │ site_url         │ endpoint URL                                   │
 * │ site_type        │ CHECK IN ('AUTO','RENT','BUY','FREE')          │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * Deleting a channel removes its sources, which in turn removes their sites.
 * The cascade is the database's job and only works while foreign keys are
 * enabled on the connection, see {@link de.bsommerfeld.channelstore.db.SchemaManager}.
 *
 * <h2>SQL files</h2>
 * Statements live in {@code sql/*.sql} and are loaded through
 * {@link de.bsommerfeld.channelstore.db.SqlLoader}. Per kind there is
 * {@code select-all-<table>}, {@code select-<kind>}, {@code insert-<kind>},
 * {@code update-<kind>}, {@code delete-<kind>} and {@code exists-<kind>}, plus
 * the connection-level {@code enable-foreign-keys}, {@code check-foreign-keys}
 * and {@code last-insert-id}.
 */
package de.bsommerfeld.channelstore.db;
