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

import ch.dissem.sourcing.entity.*;
import ch.dissem.sourcing.exception.NodeException;
import ch.dissem.sourcing.ports.ContentVerifierProvider;
import ch.dissem.sourcing.ports.MinerIndexRepository;
import ch.dissem.sourcing.ports.PeerQueryTransport;
import ch.dissem.sourcing.sampling.AuditSampler;
import ch.dissem.sourcing.utils.UnixTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

import static ch.dissem.sourcing.EvaluationState.*;
import static ch.dissem.sourcing.utils.ThreadFactoryBuilder.pool;

/**
 * Evaluates miners in batches, round robin. Each evaluation fetches the miner's index, requests the content
 * of one randomly chosen bucket, checks it and verifies a sample against the original source. The outcome
 * is passed to the {@link MinerScorer}.
 * <p>
 * A miner is evaluated at most once per minimum evaluation period.
 * </p>
 */
public class MinerEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(MinerEvaluator.class);

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final long DEFAULT_MIN_EVALUATION_PERIOD = 20 * UnixTime.MINUTE;
    public static final long DEFAULT_QUERY_TIMEOUT = 60;

    static final String RESPONSE_INVALID = "Response failed or is invalid";

    private final PeerQueryTransport transport;
    private final MinerIndexRepository indexRepository;
    private final MinerScorer scorer;
    private final ContentVerifierProvider verifiers;
    private final AuditSampler sampler;
    private final int batchSize;
    private final long minEvaluationPeriod;
    private final long queryTimeout;

    private final ExecutorService pool;
    private final MinerIterator iterator = new MinerIterator(Collections.<Integer>emptyList());
    private final Map<String, Long> lastEvaluated = new ConcurrentHashMap<>();
    private volatile List<Participant> participants = Collections.emptyList();

    public MinerEvaluator(PeerQueryTransport transport, MinerIndexRepository indexRepository, MinerScorer scorer,
                          ContentVerifierProvider verifiers, AuditSampler sampler,
                          int batchSize, long minEvaluationPeriod, long queryTimeout) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.transport = transport;
        this.indexRepository = indexRepository;
        this.scorer = scorer;
        this.verifiers = verifiers;
        this.sampler = sampler;
        this.batchSize = batchSize;
        this.minEvaluationPeriod = minEvaluationPeriod;
        this.queryTimeout = queryTimeout;
        this.pool = Executors.newFixedThreadPool(batchSize, pool("evaluation").daemon().build());
    }

    /**
     * Sets the known participants. Only miners will be evaluated.
     *
     * @param participants all participants, ordered by uid
     */
    public void setParticipants(List<Participant> participants) {
        List<Integer> minerUids = new ArrayList<>();
        for (Participant participant : participants) {
            if (participant.isMiner()) {
                minerUids.add(participant.getUid());
            }
        }
        this.participants = Collections.unmodifiableList(new ArrayList<>(participants));
        iterator.setMinerUids(minerUids);
    }

    public List<Participant> getParticipants() {
        return participants;
    }

    /**
     * Evaluates the next batch of miners, unless the next miner was evaluated too recently.
     *
     * @return the number of seconds to wait before the next call, 0 if the next batch may run immediately
     */
    public long runNextEvalBatch() {
        if (iterator.isEmpty()) {
            LOG.debug("No miners to evaluate");
            return minEvaluationPeriod;
        }
        int next = iterator.peek();
        Long last = lastEvaluated.get(participant(next).getHotkey());
        long now = UnixTime.now();
        if (last != null && now - last < minEvaluationPeriod) {
            return last + minEvaluationPeriod - now;
        }

        Set<Integer> uids = new LinkedHashSet<>();
        int count = Math.min(batchSize, iterator.size());
        for (int i = 0; i < count; i++) {
            uids.add(iterator.next());
        }
        evaluate(uids);
        return 0;
    }

    /**
     * Evaluates the given miners concurrently and waits until all evaluations are done.
     */
    public List<EvaluationOutcome> evaluate(Collection<Integer> uids) {
        List<Callable<EvaluationOutcome>> tasks = new ArrayList<>(uids.size());
        for (final Integer uid : uids) {
            tasks.add(() -> {
                try {
                    return evaluateMiner(uid);
                } catch (RuntimeException e) {
                    LOG.error("Evaluation of miner " + uid + " failed", e);
                    return null;
                }
            });
        }
        List<Future<EvaluationOutcome>> futures;
        try {
            futures = pool.invokeAll(tasks);
        } catch (InterruptedException e) {
            LOG.info("Interrupted while waiting for evaluation batch");
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        }
        List<EvaluationOutcome> outcomes = new ArrayList<>(uids.size());
        for (Future<EvaluationOutcome> future : futures) {
            try {
                EvaluationOutcome outcome = future.get();
                if (outcome != null) {
                    outcomes.add(outcome);
                }
            } catch (InterruptedException e) {
                LOG.info("Interrupted while collecting evaluation results");
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException | CancellationException e) {
                LOG.error(e.getMessage(), e);
            }
        }
        return outcomes;
    }

    /**
     * Runs the full evaluation of a single miner and reports the result to the scorer. If the thread is
     * interrupted while waiting for the miner, the evaluation is {@link EvaluationState#ABORTED} and nothing
     * is reported.
     */
    public EvaluationOutcome evaluateMiner(int uid) {
        Participant miner = participant(uid);
        String hotkey = miner.getHotkey();
        lastEvaluated.put(hotkey, UnixTime.now());
        LOG.trace("{}: Evaluating miner {}", uid, hotkey);

        EvaluationState state = FETCH_INDEX;
        try {
            ScorableMinerIndex index = updateAndGetIndex(miner);
            if (index == null || index.isEmpty()) {
                LOG.trace("{}: No scorable index for miner. Resetting score.", hotkey);
                scorer.reset(uid);
                return new EvaluationOutcome(uid, hotkey, NO_DATA, state,
                    Collections.<ValidationResult>emptyList());
            }

            state = SELECT;
            ScorableDataEntityBucket bucket = sampler.chooseBucket(index);
            LOG.trace("{}: Querying miner for bucket {}", hotkey, bucket);

            state = FETCH_CONTENT;
            DataEntityBucketResponse response = requestBucket(miner, bucket);
            if (!DataEntityBucketResponse.isValid(response)) {
                LOG.trace("{}: Miner returned an invalid/failed response", hotkey);
                return score(uid, hotkey, index, state, ValidationResult.invalid(RESPONSE_INVALID));
            }

            state = BASIC_CHECK;
            List<DataEntity> entities = response.getEntities();
            LOG.trace("{}: Performing basic validation on {} entities", hotkey, entities.size());
            ValidationResult basic = sampler.validateBatch(entities, bucket);
            if (!basic.isValid()) {
                LOG.trace("{}: Failed basic entity validation with reason {}", hotkey, basic.getReason());
                return score(uid, hotkey, index, state, basic);
            }

            state = SAMPLE_VERIFY;
            List<DataEntity> sample = sampler.chooseEntities(entities);
            LOG.trace("{}: Basic validation passed. Verifying {}", hotkey, sample);
            List<ValidationResult> results = verifiers.get(bucket.getId().getSource()).validate(sample);
            if (results.isEmpty()) {
                results = Collections.singletonList(ValidationResult.invalid("Content could not be verified"));
            }
            return score(uid, hotkey, index, state, results);
        } catch (InterruptedException e) {
            LOG.debug("{}: Evaluation interrupted at {}, discarding it", hotkey, state);
            Thread.currentThread().interrupt();
            return new EvaluationOutcome(uid, hotkey, ABORTED, state, Collections.<ValidationResult>emptyList());
        }
    }

    private EvaluationOutcome score(int uid, String hotkey, ScorableMinerIndex index,
                                    EvaluationState decidedAt, ValidationResult result) {
        return score(uid, hotkey, index, decidedAt, Collections.singletonList(result));
    }

    private EvaluationOutcome score(int uid, String hotkey, ScorableMinerIndex index,
                                    EvaluationState decidedAt, List<ValidationResult> results) {
        scorer.onMinerEvaluated(uid, index, results);
        return new EvaluationOutcome(uid, hotkey, SCORED, decidedAt, results);
    }

    /**
     * Requests the miner's current index and stores it if it's valid.
     *
     * @return the latest known index of the miner, or null if it never supplied one
     */
    private ScorableMinerIndex updateAndGetIndex(Participant miner) throws InterruptedException {
        String hotkey = miner.getHotkey();
        LOG.trace("{}: Updating miner index", hotkey);
        MinerIndexResponse response = requestIndex(miner);
        if (MinerIndexResponse.isValid(response) && hotkey.equals(response.getIndex().getHotkey())) {
            LOG.trace("{}: Got new miner index. Size={}", hotkey, response.getIndex().getBuckets().size());
            indexRepository.store(response.getIndex());
        } else {
            LOG.trace("{}: Miner returned an invalid/failed response for the index", hotkey);
        }
        return indexRepository.getScorableIndex(hotkey, getCredibleHotkeys());
    }

    private Set<String> getCredibleHotkeys() {
        List<Participant> participants = this.participants;
        Set<String> result = new HashSet<>();
        for (Integer uid : scorer.getCredibleMiners()) {
            if (uid < participants.size()) {
                result.add(participants.get(uid).getHotkey());
            }
        }
        return result;
    }

    private MinerIndexResponse requestIndex(Participant miner) throws InterruptedException {
        try {
            return await(transport.requestIndex(miner, queryTimeout), miner.getHotkey());
        } catch (NodeException e) {
            LOG.debug("{}: {}", miner.getHotkey(), e.getMessage());
            return null;
        }
    }

    private DataEntityBucketResponse requestBucket(Participant miner, ScorableDataEntityBucket bucket)
        throws InterruptedException {
        try {
            return await(transport.requestBucket(miner, bucket.getId(), queryTimeout), miner.getHotkey());
        } catch (NodeException e) {
            LOG.debug("{}: {}", miner.getHotkey(), e.getMessage());
            return null;
        }
    }

    /**
     * @return the result, or null if the request failed or timed out
     * @throws InterruptedException if the thread was interrupted while waiting, the request is cancelled then
     */
    private <T> T await(Future<T> future, String hotkey) throws InterruptedException {
        if (future == null) {
            return null;
        }
        try {
            return future.get(queryTimeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            LOG.debug("{}: Request timed out after {} seconds", hotkey, queryTimeout);
            future.cancel(true);
        } catch (ExecutionException e) {
            LOG.debug(hotkey + ": Request failed", e.getCause());
        } catch (CancellationException e) {
            LOG.debug("{}: Request was cancelled", hotkey);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
        return null;
    }

    private Participant participant(int uid) {
        List<Participant> participants = this.participants;
        if (uid < 0 || uid >= participants.size()) {
            throw new IllegalArgumentException("Unknown uid " + uid);
        }
        return participants.get(uid);
    }

    public boolean isShutdown() {
        return pool.isShutdown();
    }

    /**
     * Stops the evaluation threads, waiting for running evaluations to finish.
     */
    public void shutdown() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(2 * queryTimeout + 1, TimeUnit.SECONDS)) {
                LOG.warn("Evaluations still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
