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
import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;
import ch.dissem.sourcing.entity.valueobject.TimeBucket;
import ch.dissem.sourcing.exception.NodeException;
import ch.dissem.sourcing.ports.ContentVerifier;
import ch.dissem.sourcing.ports.ContentVerifierProvider;
import ch.dissem.sourcing.ports.MemoryMinerIndexRepository;
import ch.dissem.sourcing.ports.PeerQueryTransport;
import ch.dissem.sourcing.sampling.AuditSampler;
import ch.dissem.sourcing.utils.UnixTime;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import static ch.dissem.sourcing.entity.valueobject.DataSource.REDDIT;
import static ch.dissem.sourcing.utils.TestUtils.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class MinerEvaluatorTest {
    private static final long MIN_PERIOD = 20 * UnixTime.MINUTE;

    private PeerQueryTransport transport;
    private MemoryMinerIndexRepository indexRepo;
    private MinerScorer scorer;
    private ContentVerifier verifier;
    private AuditSampler sampler;
    private MinerEvaluator evaluator;

    private long hour;
    private DataEntityBucketId bucketId;
    private MinerIndex index;

    @Before
    public void setUp() {
        transport = mock(PeerQueryTransport.class);
        indexRepo = new MemoryMinerIndexRepository();
        scorer = mock(MinerScorer.class);
        verifier = mock(ContentVerifier.class);
        sampler = spy(new AuditSampler());
        evaluator = new MinerEvaluator(transport, indexRepo, scorer,
            new ContentVerifierProvider().register(REDDIT, verifier), sampler, 10, MIN_PERIOD, 1);
        evaluator.setParticipants(Arrays.asList(miner(0, "m0"), miner(1, "m1"), validator(2, "v2")));

        hour = TimeBucket.fromUnixTime(UnixTime.now()).getId();
        bucketId = bucketId(hour, REDDIT, null);
        index = new MinerIndex("m0", Collections.singletonList(new DataEntityBucket(bucketId, 6)));

        when(verifier.validate(anyList())).thenReturn(Collections.singletonList(ValidationResult.valid()));
    }

    @After
    public void tearDown() {
        evaluator.shutdown();
    }

    @Test
    public void ensureMinerWithValidContentIsScored() {
        respondWithIndex(index);
        respondWithContent(entities("abc", "def"));

        EvaluationOutcome outcome = evaluator.evaluateMiner(0);

        assertThat(outcome.getState(), is(EvaluationState.SCORED));
        assertThat(outcome.getDecidedAt(), is(EvaluationState.SAMPLE_VERIFY));
        verify(verifier).validate(anyList());
        verify(scorer).onMinerEvaluated(eq(0), any(ScorableMinerIndex.class),
            eq(Collections.singletonList(ValidationResult.valid())));
        assertThat(indexRepo.getIndex("m0"), is(index));
    }

    @Test
    public void ensureMinerWithoutScorableContentIsReset() {
        respondWithIndex(new MinerIndex("m0", Collections.singletonList(new DataEntityBucket(bucketId, 0))));

        EvaluationOutcome outcome = evaluator.evaluateMiner(0);

        assertThat(outcome.getState(), is(EvaluationState.NO_DATA));
        verify(scorer).reset(0);
        verify(sampler, never()).chooseBucket(any(ScorableMinerIndex.class));
        verify(transport, never()).requestBucket(any(Participant.class), any(DataEntityBucketId.class), anyLong());
        verify(scorer, never()).onMinerEvaluated(anyInt(), any(ScorableMinerIndex.class), anyList());
    }

    @Test
    public void ensureMinerWithoutIndexIsReset() {
        when(transport.requestIndex(any(Participant.class), anyLong()))
            .thenReturn(this.<MinerIndexResponse>failed(new NodeException("connection refused")));

        EvaluationOutcome outcome = evaluator.evaluateMiner(0);

        assertThat(outcome.getState(), is(EvaluationState.NO_DATA));
        assertThat(outcome.getDecidedAt(), is(EvaluationState.FETCH_INDEX));
        verify(scorer).reset(0);
    }

    @Test
    public void ensureStoredIndexIsUsedIfMinerFailsToAnswer() {
        indexRepo.store(index);
        when(transport.requestIndex(any(Participant.class), anyLong()))
            .thenReturn(CompletableFuture.completedFuture(MinerIndexResponse.failure()));
        respondWithContent(entities("abc", "def"));

        EvaluationOutcome outcome = evaluator.evaluateMiner(0);

        assertThat(outcome.getState(), is(EvaluationState.SCORED));
        assertThat(outcome.getDecidedAt(), is(EvaluationState.SAMPLE_VERIFY));
    }

    @Test
    public void ensureIndexOfOtherMinerIsIgnored() {
        indexRepo.store(index);
        respondWithIndex(new MinerIndex("m1", Collections.singletonList(new DataEntityBucket(bucketId, 600))));
        respondWithContent(entities("abc", "def"));

        evaluator.evaluateMiner(0);

        assertThat(indexRepo.getIndex("m0"), is(index));
        assertThat(indexRepo.getIndex("m1") == null, is(true));
    }

    @Test
    public void ensureFailedContentRequestCountsAsInvalid() {
        respondWithIndex(index);
        when(transport.requestBucket(any(Participant.class), any(DataEntityBucketId.class), anyLong()))
            .thenReturn(CompletableFuture.completedFuture(DataEntityBucketResponse.failure()));

        EvaluationOutcome outcome = evaluator.evaluateMiner(0);

        List<ValidationResult> expected = Collections.singletonList(
            ValidationResult.invalid("Response failed or is invalid"));
        assertThat(outcome.getDecidedAt(), is(EvaluationState.FETCH_CONTENT));
        assertThat(outcome.getResults(), is(expected));
        verify(scorer).onMinerEvaluated(eq(0), any(ScorableMinerIndex.class), eq(expected));
        verify(verifier, never()).validate(anyList());
    }

    @Test
    public void ensureContentRequestTimesOut() {
        respondWithIndex(index);
        CompletableFuture<DataEntityBucketResponse> never = new CompletableFuture<>();
        when(transport.requestBucket(any(Participant.class), any(DataEntityBucketId.class), anyLong()))
            .thenReturn(never);

        EvaluationOutcome outcome = evaluator.evaluateMiner(0);

        assertThat(outcome.getDecidedAt(), is(EvaluationState.FETCH_CONTENT));
        assertThat(outcome.getResults().get(0).isValid(), is(false));
        assertThat(never.isCancelled(), is(true));
    }

    @Test
    public void ensureContentNotMatchingTheBucketIsRejected() {
        respondWithIndex(index);
        respondWithContent(entities("abc"));

        EvaluationOutcome outcome = evaluator.evaluateMiner(0);

        assertThat(outcome.getDecidedAt(), is(EvaluationState.BASIC_CHECK));
        assertThat(outcome.getResults().get(0).getReason(), is("Size not as expected. Actual=3. Claimed=3. Expected=6"));
        verify(verifier, never()).validate(anyList());
        verify(scorer).onMinerEvaluated(eq(0), any(ScorableMinerIndex.class), eq(outcome.getResults()));
    }

    @Test
    public void ensureBatchOnlyEvaluatesMiners() {
        respondWithIndex(index);
        respondWithContent(entities("abc", "def"));

        assertThat(evaluator.runNextEvalBatch(), is(0L));

        verify(transport).requestIndex(eq(miner(0, "m0")), anyLong());
        verify(transport).requestIndex(eq(miner(1, "m1")), anyLong());
        verify(transport, never()).requestIndex(eq(validator(2, "v2")), anyLong());
    }

    @Test
    public void ensureMinersAreNotEvaluatedTooOften() {
        respondWithIndex(index);
        respondWithContent(entities("abc", "def"));

        assertThat(evaluator.runNextEvalBatch(), is(0L));
        long wait = evaluator.runNextEvalBatch();

        assertTrue(wait > MIN_PERIOD - 10 && wait <= MIN_PERIOD);
        verify(transport, times(2)).requestIndex(any(Participant.class), anyLong());
    }

    @Test
    public void ensureEmptyPopulationWaitsFullPeriod() {
        evaluator.setParticipants(Collections.singletonList(validator(0, "v0")));
        assertThat(evaluator.runNextEvalBatch(), is(MIN_PERIOD));
    }

    @Test
    public void ensureFailingEvaluationDoesNotAbortBatch() {
        when(transport.requestIndex(eq(miner(0, "m0")), anyLong())).thenThrow(new IllegalStateException("boom"));
        when(transport.requestIndex(eq(miner(1, "m1")), anyLong())).thenReturn(
            CompletableFuture.completedFuture(MinerIndexResponse.success(
                new MinerIndex("m1", Collections.singletonList(new DataEntityBucket(bucketId, 6))))));
        respondWithContent(entities("abc", "def"));

        List<EvaluationOutcome> outcomes = evaluator.evaluate(Arrays.asList(0, 1));

        assertThat(outcomes.size(), is(1));
        assertThat(outcomes.get(0).getUid(), is(1));
        assertThat(outcomes.get(0).getState(), is(EvaluationState.SCORED));
    }

    @Test
    public void ensureInterruptedEvaluationIsNotScored() throws Exception {
        final MinerEvaluator patient = new MinerEvaluator(transport, indexRepo, scorer,
            new ContentVerifierProvider().register(REDDIT, verifier), sampler, 10, MIN_PERIOD, 60);
        try {
            patient.setParticipants(Arrays.asList(miner(0, "m0"), miner(1, "m1")));
            respondWithIndex(index);
            CompletableFuture<DataEntityBucketResponse> never = new CompletableFuture<>();
            when(transport.requestBucket(any(Participant.class), any(DataEntityBucketId.class), anyLong()))
                .thenReturn(never);

            final AtomicReference<EvaluationOutcome> outcome = new AtomicReference<>();
            Thread thread = new Thread(() -> outcome.set(patient.evaluateMiner(0)));
            thread.start();
            Thread.sleep(500);
            thread.interrupt();
            thread.join(5000);

            assertThat(outcome.get().getState(), is(EvaluationState.ABORTED));
            assertThat(outcome.get().getDecidedAt(), is(EvaluationState.FETCH_CONTENT));
            assertTrue(outcome.get().getResults().isEmpty());
            assertTrue(never.isCancelled());
            verify(scorer, never()).onMinerEvaluated(anyInt(), any(ScorableMinerIndex.class), anyList());
            verify(scorer, never()).reset(anyInt());
        } finally {
            patient.shutdown();
        }
    }

    @Test
    public void ensureErrorInOneEvaluationDoesNotDropTheOthers() {
        when(transport.requestIndex(eq(miner(0, "m0")), anyLong())).thenThrow(new AssertionError("fatal"));
        when(transport.requestIndex(eq(miner(1, "m1")), anyLong())).thenReturn(
            CompletableFuture.completedFuture(MinerIndexResponse.success(
                new MinerIndex("m1", Collections.singletonList(new DataEntityBucket(bucketId, 6))))));
        respondWithContent(entities("abc", "def"));

        List<EvaluationOutcome> outcomes = evaluator.evaluate(Arrays.asList(0, 1));

        assertThat(outcomes.size(), is(1));
        assertThat(outcomes.get(0).getUid(), is(1));
        assertThat(outcomes.get(0).getState(), is(EvaluationState.SCORED));
    }

    private void respondWithIndex(MinerIndex index) {
        when(transport.requestIndex(any(Participant.class), anyLong()))
            .thenReturn(CompletableFuture.completedFuture(MinerIndexResponse.success(index)));
    }

    private void respondWithContent(List<DataEntity> entities) {
        when(transport.requestBucket(any(Participant.class), any(DataEntityBucketId.class), anyLong()))
            .thenReturn(CompletableFuture.completedFuture(DataEntityBucketResponse.success(entities)));
    }

    private List<DataEntity> entities(String... contents) {
        DataEntity[] result = new DataEntity[contents.length];
        for (int i = 0; i < contents.length; i++) {
            result[i] = entity("reddit/" + i, hour * UnixTime.HOUR + i, REDDIT, null, contents[i]);
        }
        return Arrays.asList(result);
    }

    private <T> Future<T> failed(Throwable cause) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(cause);
        return future;
    }
}
