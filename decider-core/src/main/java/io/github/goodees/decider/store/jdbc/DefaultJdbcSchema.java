package io.github.goodees.decider.store.jdbc;

/*-
 * #%L
 * decider
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * JDBC schema of an event log shared by all streams. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(STREAM_ID, STREAM_VERSION, CREATED_AT, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD) primary key
 * (STREAM_ID, STREAM_VERSION)</li>
 * <li><em>versionTable</em>(STREAM_ID, VERSION) primary key (STREAM_ID)</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String versionTable;

    public DefaultJdbcSchema(String eventTable, String versionTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getVersionTable()
                + " WHERE STREAM_ID=?");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected PreparedStatement createStreamVersion(Connection connection, String streamId, long startVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (STREAM_ID, VERSION) VALUES (?, ?)");
        st.setString(1, streamId);
        st.setLong(2, startVersion);
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, String streamId, long startVersion,
            long endVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET VERSION=? WHERE STREAM_ID=? AND VERSION=?");
        st.setLong(1, endVersion);
        st.setString(2, streamId);
        st.setLong(3, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection, String streamId) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (STREAM_ID, STREAM_VERSION, CREATED_AT, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD)"
                + " VALUES (?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, String streamId, long version, String type,
            int payloadVersion, String payload) throws SQLException {
        insertEvent.setString(1, streamId);
        insertEvent.setLong(2, version);
        insertEvent.setTimestamp(3, new Timestamp(System.currentTimeMillis()));
        insertEvent.setString(4, type);
        insertEvent.setInt(5, payloadVersion);
        insertEvent.setString(6, payload);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String streamId, long afterVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT STREAM_ID, STREAM_VERSION, EVENT_TYPE, "
                + "PAYLOAD_VERSION, PAYLOAD FROM " + getEventTable()
                + " WHERE STREAM_ID=? AND STREAM_VERSION > ? ORDER BY STREAM_VERSION");
        st.setString(1, streamId);
        st.setLong(2, afterVersion);
        return st;
    }

    @Override
    protected long readEventVersion(ResultSet rs) throws SQLException {
        return rs.getLong(2);
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(4);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }
}
