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

package ch.dissem.sourcing.ports;

import ch.dissem.sourcing.entity.MinerIndex;
import ch.dissem.sourcing.entity.ScorableMinerIndex;
import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;
import org.junit.Test;

import java.util.*;

import static ch.dissem.sourcing.entity.valueobject.DataSource.REDDIT;
import static ch.dissem.sourcing.entity.valueobject.DataSource.X;
import static ch.dissem.sourcing.utils.TestUtils.*;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

public class ScorableIndexCalculatorTest {
    private static final DataEntityBucketId KEY = bucketId(100, X, "crypto");

    @Test
    public void ensureUncontestedClaimIsFullyScorable() {
        MinerIndex miner = index("m", bucket(100, X, "crypto", 150), bucket(101, REDDIT, null, 20));

        Map<DataEntityBucketId, Long> scorable = ScorableIndexCalculator.scorableBytes(
            miner, Collections.<MinerIndex>emptyList(), Collections.<String>emptySet());

        assertThat(scorable.get(KEY), is(150L));
        assertThat(scorable.get(bucketId(101, REDDIT, null)), is(20L));
    }

    @Test
    public void ensureCredibleMinersArePreferredOverUntrustedOnes() {
        MinerIndex a = index("a", bucket(100, X, "crypto", 100));
        MinerIndex b = index("b", bucket(100, X, "crypto", 60));
        MinerIndex m = index("m", bucket(100, X, "crypto", 150));
        Set<String> credible = set("a", "b");

        assertThat(scorable(m, credible, a, b), is(50L));
        assertThat(scorable(a, credible, a, b, m), is(100L));
        assertThat(scorable(b, credible, a, b, m), nullValue());
    }

    @Test
    public void ensureUntrustedMinersDoNotAffectEachOther() {
        MinerIndex x = index("x", bucket(100, X, "crypto", 1000));
        MinerIndex m = index("m", bucket(100, X, "crypto", 50));

        assertThat(scorable(m, set("a"), x), is(50L));
    }

    @Test
    public void ensureEachUntrustedMinerOnlyCompetesWithCredibleClaims() {
        MinerIndex x = index("x", bucket(100, X, "crypto", 120));
        MinerIndex y = index("y", bucket(100, X, "crypto", 90));

        assertThat(scorable(x, set("a"), y), is(120L));
        assertThat(scorable(y, set("a"), x), is(90L));

        MinerIndex a = index("a", bucket(100, X, "crypto", 100));

        assertThat(scorable(x, set("a"), a, y), is(20L));
        assertThat(scorable(y, set("a"), a, x), nullValue());
    }

    @Test
    public void ensureCredibleMinersAreServedByHotkey() {
        MinerIndex a = index("a", bucket(100, X, "crypto", 50));
        MinerIndex b = index("b", bucket(100, X, "crypto", 80));
        MinerIndex c = index("c", bucket(100, X, "crypto", 100));
        Set<String> credible = set("a", "b", "c");

        Map<String, Map<DataEntityBucketId, Long>> all =
            ScorableIndexCalculator.scorableBytes(Arrays.asList(a, b, c), credible);

        assertThat(all.get("a").get(KEY), is(50L));
        assertThat(all.get("b").get(KEY), is(30L));
        assertThat(all.get("c").get(KEY), is(20L));
    }

    @Test
    public void ensureBytesAreNeverCountedTwice() {
        Random random = new Random(7);
        List<MinerIndex> indexes = new ArrayList<>();
        Set<String> credible = new HashSet<>();
        long largest = 0;
        for (int i = 0; i < 20; i++) {
            long size = random.nextInt(1000);
            largest = Math.max(largest, size);
            indexes.add(index("miner" + i, bucket(100, X, "crypto", size)));
            if (i % 3 != 0) {
                credible.add("miner" + i);
            }
        }
        for (MinerIndex index : indexes) {
            long total = 0;
            for (Map<DataEntityBucketId, Long> scorable :
                ScorableIndexCalculator.scorableBytes(indexes, credible).values()) {
                Long bytes = scorable.get(KEY);
                total += bytes == null ? 0 : bytes;
            }
            if (!credible.contains(index.getHotkey())) {
                Long bytes = ScorableIndexCalculator.scorableBytes(index, indexes, credible).get(KEY);
                total += bytes == null ? 0 : bytes;
            }
            assertThat(total <= largest, is(true));
        }
    }

    @Test
    public void ensureFullyClaimedBucketsAreDropped() {
        MinerIndex a = index("a", bucket(100, X, "crypto", 100));
        MinerIndex m = index("m", bucket(100, X, "crypto", 80), bucket(101, X, null, 10));

        ScorableMinerIndex scorable = ScorableIndexCalculator.calculate(m, Collections.singletonList(a), set("a"), 42);

        assertThat(scorable.getHotkey(), is("m"));
        assertThat(scorable.getLastUpdated(), is(42L));
        assertThat(scorable.getBuckets().size(), is(1));
        assertThat(scorable.getBuckets().get(0).getId(), is(bucketId(101, X, null)));
        assertThat(scorable.getTotalScorableBytes(), is(10L));
    }

    private static Long scorable(MinerIndex index, Set<String> credible, MinerIndex... claims) {
        return ScorableIndexCalculator.scorableBytes(index, Arrays.asList(claims), credible).get(KEY);
    }

    private static Set<String> set(String... hotkeys) {
        return new HashSet<>(Arrays.asList(hotkeys));
    }
}
