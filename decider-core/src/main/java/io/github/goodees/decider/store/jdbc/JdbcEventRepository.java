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

import io.github.goodees.decider.core.Pair;
import io.github.goodees.decider.core.store.EventLockingRepository;
import io.github.goodees.decider.core.store.LatestVersionProvider;
import io.github.goodees.decider.core.store.RepositoryException;
import io.github.goodees.decider.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Event repository backed by schema and serialization. Every stream has a row in version table, which is the subject
 * of optimistic lock: saving events inserts them and moves the version of the stream from the version the caller
 * has seen to the version of last event, in single transaction. When another writer moved the version in the meantime,
 * the update doesn't match and the save fails with {@link RepositoryException.Fault#OPTIMISTIC_LOCK}.
 * <p>Versions of a stream start at {@code 1}. An empty stream has latest version {@code null}.</p>
 * <p>Unless specified otherwise, every save runs in a {@linkplain TxHandler#localTransaction() local transaction}.</p>
 *
 * @param <C> command type
 * @param <E> event type
 */
public class JdbcEventRepository<C, E> implements EventLockingRepository<C, E, Long> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventRepository.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final Function<? super C, String> commandStream;
    private final Function<? super E, String> eventStream;
    private final TxHandler txHandler;

    public JdbcEventRepository(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
                               Function<? super C, String> commandStream, Function<? super E, String> eventStream) {
        this(dataSource, schema, serialization, commandStream, eventStream, TxHandler.localTransaction());
    }

    public JdbcEventRepository(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
                               Function<? super C, String> commandStream, Function<? super E, String> eventStream,
                               TxHandler txHandler) {
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be specified");
        this.schema = Objects.requireNonNull(schema, "Schema must be specified");
        this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
        this.commandStream = Objects.requireNonNull(commandStream, "Command stream function must be specified");
        this.eventStream = Objects.requireNonNull(eventStream, "Event stream function must be specified");
        this.txHandler = Objects.requireNonNull(txHandler, "Transaction handler must be specified");
    }

    @Override
    public List<Pair<E, Long>> fetchEvents(C command) throws RepositoryException {
        return readStream(commandStream.apply(command), 0);
    }

    /**
     * Read events of a stream.
     * @param streamId the stream
     * @param afterVersion only events with greater version are returned
     * @return events with their versions, in order of versions
     * @throws RepositoryException when the events cannot be read or deserialized
     */
    public List<Pair<E, Long>> readStream(String streamId, long afterVersion) throws RepositoryException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement selectEvents = schema.selectEvents(connection, streamId, afterVersion);
                ResultSet rs = selectEvents.executeQuery()) {
            List<Pair<E, Long>> result = new ArrayList<>();
            while (rs.next()) {
                long version = schema.readEventVersion(rs);
                E event = serialization.deserialize(schema.readEventPayloadVersion(rs), schema.readEventPayload(rs),
                    schema.readEventType(rs));
                if (event == null) {
                    throw RepositoryException.fetchFailed(streamId,
                        new IllegalArgumentException("Could not deserialize event " + version));
                }
                result.add(Pair.of(event, version));
            }
            return result;
        } catch (SQLException | RuntimeException e) {
            throw RepositoryException.fetchFailed(streamId, e);
        }
    }

    @Override
    public LatestVersionProvider<E, Long> getLatestVersionProvider() {
        return event -> latestVersion(eventStream.apply(event));
    }

    /**
     * Current version of a stream.
     * @param streamId the stream
     * @return version of last event of the stream, {@code null} for empty stream
     * @throws RepositoryException when version cannot be read
     */
    public Long latestVersion(String streamId) throws RepositoryException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement selectVersion = schema.selectStreamVersion(connection, streamId);
                ResultSet rs = selectVersion.executeQuery()) {
            if (rs.next()) {
                long version = schema.readStreamVersion(rs);
                return version == 0 ? null : version;
            } else {
                return null;
            }
        } catch (SQLException e) {
            throw RepositoryException.fetchFailed(streamId, e);
        }
    }

    @Override
    public List<Pair<E, Long>> save(List<E> events, Long latestVersion) throws RepositoryException {
        PersistTemplate template = createTemplate(latestVersion);
        for (E event : events) {
            template.addEvent(event);
        }
        return template.persist();
    }

    protected PersistTemplate createTemplate(Long latestVersion) {
        return new PersistTemplate(latestVersion == null ? 0 : latestVersion);
    }

    protected void prepareInsert(PreparedStatement insertEvent, String streamId, long version, E event)
            throws SQLException {
        schema.prepareInsert(insertEvent, streamId, version, serialization.typeOf(event),
            serialization.payloadVersion(event), serialization.serialize(event));
    }

    protected class PersistTemplate {
        private final List<Pair<E, Long>> events = new ArrayList<>();
        private final long startVersion;
        private String streamId;
        private long endVersion;

        PersistTemplate(long startVersion) {
            this.startVersion = startVersion;
            this.endVersion = startVersion;
        }

        void addEvent(E event) throws RepositoryException {
            String eventStreamId = eventStream.apply(event);
            if (streamId == null) {
                streamId = eventStreamId;
            } else if (!streamId.equals(eventStreamId)) {
                throw RepositoryException.multipleStreams(streamId, eventStreamId);
            }
            endVersion++;
            events.add(Pair.of(event, endVersion));
        }

        public List<Pair<E, Long>> persist() throws RepositoryException {
            if (events.isEmpty()) {
                return Collections.emptyList();
            }
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    try (PreparedStatement selectVersion = schema.selectStreamVersion(connection, streamId);
                            ResultSet rs = selectVersion.executeQuery()) {
                        checkSourceVersion(connection, rs);
                    }
                    try (PreparedStatement insertEvent = schema.insertEvent(connection, streamId);
                            PreparedStatement updateVersion = schema.updateStreamVersion(connection, streamId,
                                startVersion, endVersion)) {
                        storeEvents(insertEvent);
                        updateVersion(updateVersion);
                    }
                    txHandler.commit(connection);
                } catch (SQLException | RepositoryException | RuntimeException e) {
                    txHandler.rollback(connection);
                    throw e;
                }
                logger.debug("Stream {} moved from version {} to {}", streamId, startVersion, endVersion);
                return Collections.unmodifiableList(events);
            } catch (SQLException | RuntimeException e) {
                throw RepositoryException.storeFailed(streamId, e);
            }
        }

        private void updateVersion(PreparedStatement updateVersion) throws SQLException, RepositoryException {
            int result = updateVersion.executeUpdate();
            if (result != 1) {
                throw RepositoryException.optimisticLock(streamId, startVersion);
            }
        }

        private void storeEvents(PreparedStatement insertEvent) throws SQLException {
            for (Pair<E, Long> event : events) {
                prepareInsert(insertEvent, streamId, event.getSecond(), event.getFirst());
                insertEvent.addBatch();
            }
            insertEvent.executeBatch();
        }

        private void checkSourceVersion(Connection connection, ResultSet rs) throws SQLException, RepositoryException {
            if (!rs.next()) {
                if (startVersion != 0) {
                    throw RepositoryException.optimisticLock(streamId, startVersion, null);
                }
                // no stream version - create a new one.
                try (PreparedStatement createVersion = schema.createStreamVersion(connection, streamId, startVersion)) {
                    createVersion.executeUpdate();
                }
            } else {
                long version = schema.readStreamVersion(rs);
                if (version != startVersion) {
                    throw RepositoryException.optimisticLock(streamId, startVersion, version);
                }
            }
        }
    }

    /**
     * Transaction demarcation of a save.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;

        /**
         * Statements are executed on the connection as is, the transaction is demarcated by a container. A connection
         * in auto-commit mode is refused, as the statements of a save would be committed one by one.
         * @return handler that doesn't demarcate transactions
         */
        static TxHandler containerManaged() {
            return CONTAINER_MANAGED;
        }

        /**
         * Every save runs in a local transaction of its connection, which is rolled back on failure.
         * @return handler using local transactions
         */
        static TxHandler localTransaction() {
            return LOCAL_TRANSACTION;
        }
    }

    private static final TxHandler CONTAINER_MANAGED = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            if (connection.getAutoCommit()) {
                connection.close();
                throw new SQLException("Connection is in auto-commit mode, it is not enlisted in a transaction");
            }
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };

    private static final TxHandler LOCAL_TRANSACTION = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };
}
