package com.wscrape.store;

import com.wscrape.model.LoginEntry;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Inserts entries into the {@code LoginEntry} table:
 *
 * <pre>
 * create table LoginEntry
 * (
 *     record_time timestamp    not null,
 *     user        varchar(16)  not null,
 *     tty         varchar(16)  not null,
 *     `from`      varchar(32)  not null,
 *     `login@`    varchar(16)  not null,
 *     idle        varchar(16)  not null,
 *     jcpu        varchar(16)  not null,
 *     pcpu        varchar(16)  not null,
 *     what        varchar(256) not null,
 *     primary key (user, record_time, tty)
 * );
 * </pre>
 */
public class JdbcLoginEntrySink implements LoginEntrySink {

    static final String INSERT_SQL = "INSERT INTO LoginEntry "
            + "(record_time, user, tty, `from`, `login@`, idle, jcpu, pcpu, what) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final DataSource dataSource;

    public JdbcLoginEntrySink(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public void save(LoginEntry entry) throws PersistenceException {
        Objects.requireNonNull(entry, "entry");
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, entry.getRecordTime());
            ps.setString(2, entry.getUser());
            ps.setString(3, entry.getTty());
            ps.setString(4, entry.getFrom());
            ps.setString(5, entry.getLoginAt());
            ps.setString(6, entry.getIdle());
            ps.setString(7, entry.getJcpu());
            ps.setString(8, entry.getPcpu());
            ps.setString(9, entry.getWhat());
            ps.execute();
        } catch (SQLException e) {
            String key = entry.getUser() + "@" + entry.getTty() + " " + entry.getRecordTime();
            if (SqlStates.isConstraintViolation(e)) {
                throw new DuplicateLoginEntryException("Login entry already stored: " + key, e);
            }
            throw new PersistenceException("Failed to store login entry " + key + ": " + e.getMessage(), e);
        }
    }
}
