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

package ch.dissem.sourcing;

import ch.dissem.sourcing.entity.MinerTrustState;
import ch.dissem.sourcing.entity.ScorableDataEntityBucket;
import ch.dissem.sourcing.entity.ScorableMinerIndex;
import ch.dissem.sourcing.entity.ValidationResult;
import ch.dissem.sourcing.rewards.RewardDistribution;
import ch.dissem.sourcing.utils.UnixTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tracks score and credibility of every miner, indexed by uid. Both are exponential moving averages: the
 * credibility over the share of valid audit results, the score over the value of the miner's scorable
 * content, scaled by its credibility squared.
 * <p>
 * All reads and updates synchronize on the scorer, readers always get copies.
 * </p>
 */
public class MinerScorer {
    private static final Logger LOG = LoggerFactory.getLogger(MinerScorer.class);

    public static final double STARTING_CREDIBILITY = 0.5;
    public static final double CREDIBLE_THRESHOLD = 0.8;
    public static final double DEFAULT_ALPHA = 0.05;

    private final RewardDistribution rewardDistribution;
    private final double alpha;

    private double[] scores;
    private double[] credibility;

    public MinerScorer(int size, RewardDistribution rewardDistribution) {
        this(size, rewardDistribution, DEFAULT_ALPHA);
    }

    public MinerScorer(int size, RewardDistribution rewardDistribution, double alpha) {
        this(new MinerTrustState(new double[size], startingCredibility(size)), rewardDistribution, alpha);
    }

    public MinerScorer(MinerTrustState state, RewardDistribution rewardDistribution, double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("Alpha must be within (0, 1]: " + alpha);
        }
        this.scores = state.getScores();
        this.credibility = state.getCredibility();
        this.rewardDistribution = rewardDistribution;
        this.alpha = alpha;
    }

    private static double[] startingCredibility(int size) {
        double[] result = new double[size];
        Arrays.fill(result, STARTING_CREDIBILITY);
        return result;
    }

    public synchronized int size() {
        return scores.length;
    }

    public synchronized double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    public synchronized double[] getCredibility() {
        return Arrays.copyOf(credibility, credibility.length);
    }

    public synchronized double getScore(int uid) {
        checkUid(uid);
        return scores[uid];
    }

    public synchronized double getCredibility(int uid) {
        checkUid(uid);
        return credibility[uid];
    }

    public synchronized MinerTrustState getState() {
        return new MinerTrustState(scores, credibility);
    }

    /**
     * Replaces all scores and credibility values, e.g. with a previously saved state.
     */
    public synchronized void restore(MinerTrustState state) {
        scores = state.getScores();
        credibility = state.getCredibility();
    }

    public synchronized void reset(int uid) {
        checkUid(uid);
        scores[uid] = 0;
        credibility[uid] = STARTING_CREDIBILITY;
    }

    /**
     * Grows the tables to the given number of miners. New miners start without score and with the
     * starting credibility.
     *
     * @throws IllegalArgumentException if the tables would shrink
     */
    public synchronized void resize(int size) {
        if (size < scores.length) {
            throw new IllegalArgumentException("Tried to shrink the number of miners from "
                + scores.length + " to " + size);
        }
        int oldSize = scores.length;
        scores = Arrays.copyOf(scores, size);
        credibility = Arrays.copyOf(credibility, size);
        Arrays.fill(credibility, oldSize, size, STARTING_CREDIBILITY);
    }

    /**
     * @return the uids of all miners considered trustworthy, in ascending order
     */
    public synchronized List<Integer> getCredibleMiners() {
        List<Integer> result = new ArrayList<>();
        for (int uid = 0; uid < credibility.length; uid++) {
            if (credibility[uid] >= CREDIBLE_THRESHOLD) {
                result.add(uid);
            }
        }
        return result;
    }

    public void onMinerEvaluated(int uid, ScorableMinerIndex index, List<ValidationResult> results) {
        onMinerEvaluated(uid, index, results, UnixTime.now());
    }

    /**
     * Updates credibility from the audit results, then the score from the value of the index.
     *
     * @param now Unix time used for the age of the content
     * @throws IllegalArgumentException if there are no results
     */
    public void onMinerEvaluated(int uid, ScorableMinerIndex index, List<ValidationResult> results, long now) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("At least one validation result is required");
        }
        int valid = 0;
        for (ValidationResult result : results) {
            if (result.isValid()) {
                valid++;
            }
        }
        double fractionValid = (double) valid / results.size();

        double reward = 0;
        if (index != null) {
            for (ScorableDataEntityBucket bucket : index.getBuckets()) {
                reward += rewardDistribution.getScore(bucket, now);
            }
        }
        // negative label factors must not make the score negative
        reward = Math.max(0, reward);

        synchronized (this) {
            checkUid(uid);
            credibility[uid] = alpha * fractionValid + (1 - alpha) * credibility[uid];
            double scaledReward = reward * credibility[uid] * credibility[uid];
            scores[uid] = alpha * scaledReward + (1 - alpha) * scores[uid];
            LOG.trace("Evaluated miner {}. Score={}. Credibility={}", uid, scores[uid], credibility[uid]);
        }
    }

    private void checkUid(int uid) {
        if (uid < 0 || uid >= scores.length) {
            throw new IllegalArgumentException("Unknown uid " + uid + ", there are " + scores.length + " miners");
        }
    }
}
