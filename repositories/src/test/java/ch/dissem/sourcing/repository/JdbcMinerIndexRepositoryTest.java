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
import ch.dissem.sourcing.entity.ScorableMinerIndex;
import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;
import ch.dissem.sourcing.entity.valueobject.DataLabel;
import ch.dissem.sourcing.entity.valueobject.DataSource;
import ch.dissem.sourcing.entity.valueobject.TimeBucket;
import ch.dissem.sourcing.utils.UnixTime;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static ch.dissem.sourcing.entity.valueobject.DataSource.REDDIT;
import static ch.dissem.sourcing.entity.valueobject.DataSource.X;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class JdbcMinerIndexRepositoryTest {
    private TestJdbcConfig config;
    private JdbcMinerIndexRepository repo;

    private MinerIndex indexA;

    @Before
    public void setUp() {
        config = new TestJdbcConfig();
        config.reset();

        repo = new JdbcMinerIndexRepository(config);

        indexA = new MinerIndex("a", Arrays.asList(
            bucket(10, X, "#bitcoin", 100),
            bucket(10, REDDIT, null, 20),
            bucket(11, REDDIT, "r/bitcoin", 30)
        ));
        repo.store(indexA);
        repo.store(new MinerIndex("b", Collections.singletonList(bucket(10, X, "#bitcoin", 150))));
    }

    @Test
    public void ensureIndexIsStoredAndRead() {
        MinerIndex index = repo.getIndex("a");
        assertThat(index.getHotkey(), is("a"));
        assertThat(index.getBuckets(), is(indexA.getBuckets()));
    }

    @Test
    public void ensureUnknownMinerHasNoIndex() {
        assertThat(repo.getIndex("unknown"), nullValue());
        assertThat(repo.getScorableIndex("unknown", Collections.<String>emptySet()), nullValue());
        assertThat(repo.getLastUpdated("unknown"), nullValue());
    }

    @Test
    public void ensureEmptyIndexIsKnown() {
        repo.store(new MinerIndex("c", Collections.<DataEntityBucket>emptyList()));

        ScorableMinerIndex index = repo.getScorableIndex("c", Collections.<String>emptySet());
        assertThat(index.getBuckets().isEmpty(), is(true));
        assertThat(index.isEmpty(), is(true));
    }

    @Test
    public void ensureIndexIsReplacedWholesale() {
        repo.store(new MinerIndex("a", Collections.singletonList(bucket(12, X, null, 5))));

        MinerIndex index = repo.getIndex("a");
        assertThat(index.getBuckets().size(), is(1));
        assertThat(index.getTotalSizeBytes(), is(5L));
    }

    @Test
    public void ensureClaimsOfCredibleMinersAreDeducted() {
        ScorableMinerIndex b = repo.getScorableIndex("b", Collections.singleton("a"));
        assertThat(b.getTotalScorableBytes(), is(50L));

        ScorableMinerIndex a = repo.getScorableIndex("a", new HashSet<>(Arrays.asList("a", "b")));
        assertThat(a.getTotalScorableBytes(), is(150L));
    }

    @Test
    public void ensureLastUpdatedIsStored() {
        Long lastUpdated = repo.getLastUpdated("a");
        assertTrue(UnixTime.now() - lastUpdated < 5);
        assertThat(repo.getScorableIndex("a", Collections.<String>emptySet()).getLastUpdated(), is((long) lastUpdated));
    }

    @Test
    public void ensureIndexIsDeleted() {
        repo.delete("a");
        assertThat(repo.getIndex("a"), nullValue());
        assertThat(repo.getHotkeys(), is(Collections.singletonList("b")));
        assertThat(repo.getScorableIndex("b", Collections.singleton("a")).getTotalScorableBytes(), is(150L));
    }

    private static DataEntityBucket bucket(long timeBucket, DataSource source,
                                           String label, long size) {
        return new DataEntityBucket(new DataEntityBucketId(new TimeBucket(timeBucket), source, DataLabel.of(label)), size);
    }
}
