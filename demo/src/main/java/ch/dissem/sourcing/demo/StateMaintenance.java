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

package ch.dissem.sourcing.demo;

import ch.dissem.sourcing.MinerScorer;
import ch.dissem.sourcing.entity.MinerIndex;
import ch.dissem.sourcing.entity.MinerTrustState;
import ch.dissem.sourcing.entity.ScorableDataEntityBucket;
import ch.dissem.sourcing.entity.ScorableMinerIndex;
import ch.dissem.sourcing.ports.MinerIndexRepository;
import ch.dissem.sourcing.ports.ScorerStateRepository;
import ch.dissem.sourcing.rewards.RewardDistribution;
import ch.dissem.sourcing.utils.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Inspects and repairs the persisted state of a validator while it isn't running.
 */
public class StateMaintenance {
    private static final Logger LOG = LoggerFactory.getLogger(StateMaintenance.class);

    private final ScorerStateRepository stateRepository;
    private final MinerIndexRepository indexRepository;
    private final RewardDistribution rewardDistribution;

    public StateMaintenance(ScorerStateRepository stateRepository, MinerIndexRepository indexRepository,
                            RewardDistribution rewardDistribution) {
        this.stateRepository = stateRepository;
        this.indexRepository = indexRepository;
        this.rewardDistribution = rewardDistribution;
    }

    private MinerScorer loadScorer() {
        return loadScorer(stateRepository.load());
    }

    private MinerScorer loadScorer(MinerTrustState state) {
        if (state == null) {
            return new MinerScorer(0, rewardDistribution);
        }
        return new MinerScorer(state, rewardDistribution, MinerScorer.DEFAULT_ALPHA);
    }

    public Property status() {
        MinerScorer scorer = loadScorer();
        double total = 0;
        for (double score : scorer.getScores()) {
            total += score;
        }
        return new Property("state", null,
            new Property("miners", scorer.size()),
            new Property("credible", scorer.getCredibleMiners().size()),
            new Property("total score", total),
            new Property("max age", rewardDistribution.getModel().getMaxAgeInHours() + "h")
        );
    }

    /**
     * @return one line per miner with its uid, score and credibility
     */
    public String scores() {
        MinerScorer scorer = loadScorer();
        double[] scores = scorer.getScores();
        double[] credibility = scorer.getCredibility();
        if (scores.length == 0) {
            return "No miners evaluated yet.";
        }
        StringBuilder result = new StringBuilder();
        for (int uid = 0; uid < scores.length; uid++) {
            result.append(String.format(Locale.ROOT, "%5d  score=%.6f  credibility=%.4f%n", uid, scores[uid], credibility[uid]));
        }
        return result.toString();
    }

    public List<Integer> credibleMiners() {
        return loadScorer().getCredibleMiners();
    }

    /**
     * Sets the miner's score to zero and its credibility back to the starting value.
     *
     * @throws IllegalArgumentException if there is no such miner
     */
    public void reset(int uid) {
        MinerTrustState state = stateRepository.load();
        MinerScorer scorer = loadScorer(state);
        scorer.reset(uid);
        save(scorer, state);
        LOG.info("Reset miner {}", uid);
    }

    /**
     * @throws IllegalArgumentException if the number of miners would shrink
     */
    public void resize(int size) {
        MinerTrustState state = stateRepository.load();
        MinerScorer scorer = loadScorer(state);
        scorer.resize(size);
        save(scorer, state);
        LOG.info("Resized scorer to {} miners", size);
    }

    private void save(MinerScorer scorer, MinerTrustState loaded) {
        List<String> hotkeys = loaded == null ? Collections.<String>emptyList() : loaded.getHotkeys();
        stateRepository.save(scorer.getState().withHotkeys(hotkeys));
    }

    /**
     * Describes the stored index of a miner. The scorable part is calculated as if no credible miner
     * claimed the same buckets, as the current credible hotkeys aren't known offline.
     *
     * @return the description, or null if there is no index for the given hotkey
     */
    public Property index(String hotkey) {
        MinerIndex index = indexRepository.getIndex(hotkey);
        if (index == null) {
            return null;
        }
        ScorableMinerIndex scorable = indexRepository.getScorableIndex(hotkey, Collections.<String>emptySet());
        double reward = 0;
        for (ScorableDataEntityBucket bucket : scorable.getBuckets()) {
            reward += rewardDistribution.getScore(bucket);
        }
        return new Property("index", hotkey,
            new Property("last updated", indexRepository.getLastUpdated(hotkey)),
            new Property("buckets", index.getBuckets().size()),
            new Property("size", index.getTotalSizeBytes()),
            new Property("scorable", scorable.getTotalScorableBytes()),
            new Property("reward", reward)
        );
    }
}
