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

import ch.dissem.sourcing.entity.MinerTrustState;
import ch.dissem.sourcing.exception.ApplicationException;
import ch.dissem.sourcing.ports.ScorerStateRepository;
import ch.dissem.sourcing.utils.UnixTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.sql.*;

/**
 * Stores the scorer state as a single blob.
 */
public class JdbcScorerStateRepository extends JdbcHelper implements ScorerStateRepository {
    private static final Logger LOG = LoggerFactory.getLogger(JdbcScorerStateRepository.class);

    private static final int STATE_ID = 1;

    public JdbcScorerStateRepository(JdbcConfig config) {
        super(config);
    }

    @Override
    public MinerTrustState load() {
        try (
            Connection connection = config.getConnection();
            PreparedStatement ps = connection.prepareStatement("SELECT data FROM ScorerState WHERE id=?")
        ) {
            ps.setInt(1, STATE_ID);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                Blob data = rs.getBlob("data");
                try (InputStream in = data.getBinaryStream()) {
                    return MinerTrustState.read(in);
                }
            }
        } catch (IOException | SQLException e) {
            LOG.error(e.getMessage(), e);
            throw new ApplicationException(e);
        }
    }

    @Override
    public void save(MinerTrustState state) {
        try (
            Connection connection = config.getConnection();
            PreparedStatement ps = connection.prepareStatement(
                "MERGE INTO ScorerState (id, data, saved) KEY (id) VALUES (?, ?, ?)")
        ) {
            ps.setInt(1, STATE_ID);
            writeBlob(ps, 2, state);
            ps.setLong(3, UnixTime.now());
            ps.executeUpdate();
        } catch (IOException | SQLException e) {
            LOG.error(e.getMessage(), e);
            throw new ApplicationException(e);
        }
    }
}
