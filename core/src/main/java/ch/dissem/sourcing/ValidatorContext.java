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
import ch.dissem.sourcing.entity.Participant;
import ch.dissem.sourcing.entity.valueobject.DataSource;
import ch.dissem.sourcing.ports.*;
import ch.dissem.sourcing.rewards.RewardDistribution;
import ch.dissem.sourcing.sampling.AuditSampler;
import ch.dissem.sourcing.utils.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>Use this class if you want to run a validator.</p>
 * <p>Example:</p>
 * <pre>ValidatorContext ctx = new ValidatorContext.Builder()
 *      .participantRegistry(new MyParticipantRegistry())
 *      .transport(new MyPeerQueryTransport())
 *      .contentVerifier(DataSource.REDDIT, new RedditVerifier())
 *      .minerIndexRepo(new JdbcMinerIndexRepository(jdbcConfig))
 *      .scorerStateRepo(new JdbcScorerStateRepository(jdbcConfig))
 *      .build();
 * ctx.startup();
 * </pre>
 * <p>Default values for the optional settings are defined in {@link MinerScorer} and {@link MinerEvaluator}.</p>
 */
public class ValidatorContext {
    private static final Logger LOG = LoggerFactory.getLogger(ValidatorContext.class);

    private final ParticipantRegistry participantRegistry;
    private final MinerIndexRepository minerIndexRepository;
    private final ScorerStateRepository scorerStateRepository;
    private final MinerScorer scorer;
    private final MinerEvaluator evaluator;

    private volatile EvaluationLoop loop;
    private Thread loopThread;
    private boolean shutDown;
    private volatile List<String> hotkeys = Collections.emptyList();

    private ValidatorContext(Builder builder) {
        participantRegistry = builder.participantRegistry;
        minerIndexRepository = builder.minerIndexRepository;
        scorerStateRepository = builder.scorerStateRepository;
        scorer = new MinerScorer(0, builder.rewardDistribution, builder.alpha);
        evaluator = new MinerEvaluator(builder.transport, minerIndexRepository, scorer,
            builder.contentVerifierProvider, builder.auditSampler,
            builder.batchSize, builder.minEvaluationPeriod, builder.queryTimeout);
    }

    public MinerScorer scorer() {
        return scorer;
    }

    public MinerEvaluator evaluator() {
        return evaluator;
    }

    public MinerIndexRepository minerIndexes() {
        return minerIndexRepository;
    }

    /**
     * Loads the saved scores, synchronizes the participants and starts evaluating miners in a background thread.
     *
     * @throws ch.dissem.sourcing.exception.ApplicationException if the saved state can't be loaded, in which
     *                                                           case the validator isn't started
     * @throws IllegalStateException                             if the context was already shut down
     */
    public synchronized void startup() {
        if (shutDown) {
            throw new IllegalStateException("Validator context was shut down and can't be restarted");
        }
        if (isRunning()) {
            LOG.debug("Validator already running");
            return;
        }
        MinerTrustState state = scorerStateRepository.load();
        if (state != null) {
            LOG.info("Loaded state of {} miners", state.size());
            scorer.restore(state);
            hotkeys = state.getHotkeys();
        }
        sync();
        loop = new EvaluationLoop(this);
        loopThread = new Thread(loop, "evaluation-loop");
        loopThread.setDaemon(true);
        loopThread.start();
        LOG.info("Validator started");
    }

    /**
     * Stops the evaluation loop after the running batch, saves the current state and releases the evaluation
     * threads. The context can't be started again afterwards.
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        if (loop != null) {
            loop.stop();
            try {
                loopThread.join();
            } catch (InterruptedException e) {
                LOG.info("Interrupted while waiting for the evaluation loop to stop");
                Thread.currentThread().interrupt();
            }
            loop = null;
            loopThread = null;
            saveState();
        }
        evaluator.shutdown();
        LOG.info("Validator stopped");
    }

    public boolean isRunning() {
        EvaluationLoop loop = this.loop;
        return loop != null && loop.isRunning();
    }

    /**
     * Updates the participants from the registry. Miners whose hotkey was replaced start over, and new
     * participants are added to the scorer. Replacements are detected against the last sync, or against the
     * hotkeys of the saved state after a restart.
     */
    public void sync() {
        List<Participant> participants = participantRegistry.getParticipants();
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).getUid() != i) {
                throw new IllegalStateException("Participant at position " + i
                    + " has uid " + participants.get(i).getUid());
            }
        }
        List<String> previous = hotkeys;
        int common = Math.min(previous.size(), participants.size());
        for (int uid = 0; uid < common; uid++) {
            String oldHotkey = previous.get(uid);
            if (!oldHotkey.equals(participants.get(uid).getHotkey())) {
                LOG.info("Hotkey of uid {} was replaced, resetting miner", uid);
                scorer.reset(uid);
                try {
                    minerIndexRepository.delete(oldHotkey);
                } catch (RuntimeException e) {
                    LOG.error(oldHotkey + ": Failed to delete miner index", e);
                }
            }
        }
        if (participants.size() > scorer.size()) {
            scorer.resize(participants.size());
        }
        evaluator.setParticipants(participants);
        List<String> current = new ArrayList<>(participants.size());
        for (Participant participant : participants) {
            current.add(participant.getHotkey());
        }
        hotkeys = Collections.unmodifiableList(current);
    }

    public void saveState() {
        List<String> hotkeys = this.hotkeys;
        MinerTrustState state = scorer.getState();
        if (hotkeys.size() > state.size()) {
            hotkeys = hotkeys.subList(0, state.size());
        }
        scorerStateRepository.save(state.withHotkeys(hotkeys));
        LOG.debug("Saved scorer state");
    }

    public Property status() {
        List<Participant> participants = evaluator.getParticipants();
        int miners = 0;
        for (Participant participant : participants) {
            if (participant.isMiner()) {
                miners++;
            }
        }
        return new Property("status", null,
            new Property("running", isRunning()),
            new Property("participants", participants.size()),
            new Property("miners", miners),
            new Property("credible", scorer.getCredibleMiners().size())
        );
    }

    public static final class Builder {
        PeerQueryTransport transport;
        ParticipantRegistry participantRegistry;
        MinerIndexRepository minerIndexRepository;
        ScorerStateRepository scorerStateRepository;
        ContentVerifierProvider contentVerifierProvider = new ContentVerifierProvider();
        RewardDistribution rewardDistribution;
        AuditSampler auditSampler;
        double alpha = MinerScorer.DEFAULT_ALPHA;
        int batchSize = MinerEvaluator.DEFAULT_BATCH_SIZE;
        long minEvaluationPeriod = MinerEvaluator.DEFAULT_MIN_EVALUATION_PERIOD;
        long queryTimeout = MinerEvaluator.DEFAULT_QUERY_TIMEOUT;

        public Builder transport(PeerQueryTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder participantRegistry(ParticipantRegistry participantRegistry) {
            this.participantRegistry = participantRegistry;
            return this;
        }

        public Builder minerIndexRepo(MinerIndexRepository minerIndexRepository) {
            this.minerIndexRepository = minerIndexRepository;
            return this;
        }

        public Builder scorerStateRepo(ScorerStateRepository scorerStateRepository) {
            this.scorerStateRepository = scorerStateRepository;
            return this;
        }

        public Builder contentVerifier(DataSource source,
                                       ContentVerifier verifier) {
            contentVerifierProvider.register(source, verifier);
            return this;
        }

        public Builder contentVerifierProvider(ContentVerifierProvider provider) {
            this.contentVerifierProvider = provider;
            return this;
        }

        public Builder rewardDistribution(RewardDistribution rewardDistribution) {
            this.rewardDistribution = rewardDistribution;
            return this;
        }

        public Builder auditSampler(AuditSampler auditSampler) {
            this.auditSampler = auditSampler;
            return this;
        }

        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * @param seconds a miner won't be evaluated again before this time passed
         */
        public Builder minEvaluationPeriod(long seconds) {
            this.minEvaluationPeriod = seconds;
            return this;
        }

        public Builder queryTimeout(long seconds) {
            this.queryTimeout = seconds;
            return this;
        }

        public ValidatorContext build() {
            nonNull("transport", transport);
            nonNull("participantRegistry", participantRegistry);
            nonNull("contentVerifierProvider", contentVerifierProvider);
            if (minerIndexRepository == null) {
                minerIndexRepository = new MemoryMinerIndexRepository();
            }
            if (scorerStateRepository == null) {
                scorerStateRepository = new MemoryScorerStateRepository();
            }
            if (rewardDistribution == null) {
                rewardDistribution = new RewardDistribution();
            }
            if (auditSampler == null) {
                auditSampler = new AuditSampler();
            }
            return new ValidatorContext(this);
        }

        private void nonNull(String name, Object o) {
            if (o == null) throw new IllegalStateException(name + " must not be null");
        }
    }
}
