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

/**
 * Statements used by {@link JdbcEventRepository}. Subclasses adapt the repository to concrete table layout or
 * database dialect.
 * @see DefaultJdbcSchema
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectStreamVersion(Connection connection, String streamId)
            throws SQLException;

    protected abstract PreparedStatement createStreamVersion(Connection connection, String streamId, long startVersion)
            throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateStreamVersion(Connection connection, String streamId, long startVersion,
            long endVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection, String streamId) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, String streamId, long version, String type,
            int payloadVersion, String payload) throws SQLException;

    /**
     * Select events of a stream ordered by their version.
     * @param connection the connection
     * @param streamId the stream
     * @param afterVersion only events with greater version are selected
     * @return statement to execute
     * @throws SQLException when statement cannot be prepared
     */
    protected abstract PreparedStatement selectEvents(Connection connection, String streamId, long afterVersion)
            throws SQLException;

    protected abstract long readEventVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;
}
