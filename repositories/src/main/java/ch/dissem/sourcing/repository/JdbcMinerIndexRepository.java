/*
 * Copyright 2017 Christian Basler
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ch.dissem.sourcing.repository;

import ch.dissem.sourcing.entity.DataEntityBucket;
import ch.dissem.sourcing.entity.MinerIndex;
import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;
import ch.dissem.sourcing.entity.valueobject.DataLabel;
import ch.dissem.sourcing.entity.valueobject.DataSource;
import ch.dissem.sourcing.entity.valueobject.TimeBucket;
import ch.dissem.sourcing.exception.ApplicationException;
import ch.dissem.sourcing.ports.AbstractMinerIndexRepository;
import ch.dissem.sourcing.utils.UnixTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

import static ch.dissem.sourcing.repository.JdbcHelper.placeholders;

/**
 * Stores miner indexes in the tables Miner and MinerBucket. Buckets without a label are stored with an
 * empty label.
 */
public class JdbcMinerIndexRepository extends AbstractMinerIndexRepository {
    private static final Logger LOG = LoggerFactory.getLogger(JdbcMinerIndexRepository.class);

    private final JdbcConfig config;

    public JdbcMinerIndexRepository(JdbcConfig config) {
        this.config = config;
    }

    @Override
    public void store(MinerIndex index) {
        try (Connection connection = config.getConnection()) {
            connection.setAutoCommit(false);
            try {
                updateMiner(connection, index.getHotkey(), UnixTime.now());
                deleteBuckets(connection, index.getHotkey());
                insertBuckets(connection, index);
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            LOG.error(e.getMessage(), e);
            throw new ApplicationException(e);
        }
    }

    private void updateMiner(Connection connection, String hotkey, long lastUpdated) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
            "MERGE INTO Miner (hotkey, last_updated) KEY (hotkey) VALUES (?, ?)")) {
            ps.setString(1, hotkey);
            ps.setLong(2, lastUpdated);
            ps.executeUpdate();
        }
    }

    private void deleteBuckets(Connection connection, String hotkey) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("DELETE FROM MinerBucket WHERE hotkey=?")) {
            ps.setString(1, hotkey);
            ps.executeUpdate();
        }
    }

    private void insertBuckets(Connection connection, MinerIndex index) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
            "INSERT INTO MinerBucket (hotkey, time_bucket, source, label, size_bytes) VALUES (?, ?, ?, ?, ?)")) {
            for (DataEntityBucket bucket : index.getBuckets()) {
                DataEntityBucketId id = bucket.getId();
                ps.setString(1, index.getHotkey());
                ps.setLong(2, id.getTimeBucket().getId());
                ps.setInt(3, id.getSource().getNumber());
                ps.setString(4, id.getLabel() == null ? "" : id.getLabel().getValue());
                ps.setLong(5, bucket.getSizeBytes());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public MinerIndex getIndex(String hotkey) {
        Collection<MinerIndex> result = getIndexes(Collections.singleton(hotkey));
        return result.isEmpty() ? null : result.iterator().next();
    }

    @Override
    protected Collection<MinerIndex> getIndexes(Set<String> hotkeys) {
        if (hotkeys.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> keys = new ArrayList<>(hotkeys);
        Map<String, List<DataEntityBucket>> buckets = new LinkedHashMap<>();
        try (
            Connection connection = config.getConnection();
            PreparedStatement ps = connection.prepareStatement("SELECT m.hotkey, b.time_bucket, b.source, " +
                "b.label, b.size_bytes FROM Miner m LEFT JOIN MinerBucket b ON b.hotkey=m.hotkey " +
                "WHERE m.hotkey IN (" + placeholders(keys.size()) + ") ORDER BY m.hotkey")
        ) {
            for (int i = 0; i < keys.size(); i++) {
                ps.setString(i + 1, keys.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String hotkey = rs.getString("hotkey");
                    List<DataEntityBucket> minerBuckets = buckets.get(hotkey);
                    if (minerBuckets == null) {
                        minerBuckets = new ArrayList<>();
                        buckets.put(hotkey, minerBuckets);
                    }
                    long timeBucket = rs.getLong("time_bucket");
                    if (!rs.wasNull()) {
                        minerBuckets.add(new DataEntityBucket(new DataEntityBucketId(
                            new TimeBucket(timeBucket),
                            DataSource.fromNumber(rs.getInt("source")),
                            DataLabel.of(rs.getString("label"))
                        ), rs.getLong("size_bytes")));
                    }
                }
            }
        } catch (SQLException e) {
            LOG.error(e.getMessage(), e);
            throw new ApplicationException(e);
        }
        List<MinerIndex> result = new ArrayList<>(buckets.size());
        for (Map.Entry<String, List<DataEntityBucket>> entry : buckets.entrySet()) {
            result.add(new MinerIndex(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    @Override
    public Long getLastUpdated(String hotkey) {
        try (
            Connection connection = config.getConnection();
            PreparedStatement ps = connection.prepareStatement("SELECT last_updated FROM Miner WHERE hotkey=?")
        ) {
            ps.setString(1, hotkey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getLong("last_updated");
                } else {
                    return null;
                }
            }
        } catch (SQLException e) {
            LOG.error(e.getMessage(), e);
            throw new ApplicationException(e);
        }
    }

    /**
     * @return the hotkeys of all miners with a stored index
     */
    public List<String> getHotkeys() {
        try (
            Connection connection = config.getConnection();
            Statement stmt = connection.createStatement();
            ResultSet rs = stmt.executeQuery("SELECT hotkey FROM Miner ORDER BY hotkey")
        ) {
            List<String> result = new LinkedList<>();
            while (rs.next()) {
                result.add(rs.getString("hotkey"));
            }
            return result;
        } catch (SQLException e) {
            LOG.error(e.getMessage(), e);
            throw new ApplicationException(e);
        }
    }

    @Override
    public void delete(String hotkey) {
        try (
            Connection connection = config.getConnection();
            PreparedStatement ps = connection.prepareStatement("DELETE FROM Miner WHERE hotkey=?")
        ) {
            ps.setString(1, hotkey);
            ps.executeUpdate();
        } catch (SQLException e) {
            LOG.error(e.getMessage(), e);
            throw new ApplicationException(e);
        }
    }
}
