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
import ch.dissem.sourcing.entity.ValidationResult;
import ch.dissem.sourcing.exception.ApplicationException;
import ch.dissem.sourcing.ports.*;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static ch.dissem.sourcing.entity.valueobject.DataSource.REDDIT;
import static ch.dissem.sourcing.utils.TestUtils.*;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class ValidatorContextTest {
    private ParticipantRegistry registry;
    private MemoryMinerIndexRepository indexRepo;
    private ScorerStateRepository stateRepo;
    private ValidatorContext ctx;

    @Before
    public void setUp() {
        registry = mock(ParticipantRegistry.class);
        indexRepo = new MemoryMinerIndexRepository();
        stateRepo = spy(new MemoryScorerStateRepository());
        ctx = newContext();
    }

    @After
    public void tearDown() {
        ctx.shutdown();
    }

    private ValidatorContext newContext() {
        return new ValidatorContext.Builder()
            .transport(mock(PeerQueryTransport.class))
            .participantRegistry(registry)
            .minerIndexRepo(indexRepo)
            .scorerStateRepo(stateRepo)
            .contentVerifier(REDDIT, mock(ContentVerifier.class))
            .build();
    }

    @Test
    public void ensureSyncGrowsScorer() {
        when(registry.getParticipants()).thenReturn(Arrays.asList(miner(0, "m0"), miner(1, "m1")));
        ctx.sync();
        assertThat(ctx.scorer().size(), is(2));

        when(registry.getParticipants()).thenReturn(Arrays.asList(miner(0, "m0"), miner(1, "m1"), miner(2, "m2")));
        ctx.sync();
        assertThat(ctx.scorer().size(), is(3));
        assertThat(ctx.evaluator().getParticipants().size(), is(3));
    }

    @Test
    public void ensureReplacedHotkeyIsReset() {
        when(registry.getParticipants()).thenReturn(Arrays.asList(miner(0, "m0"), miner(1, "m1")));
        ctx.sync();
        indexRepo.store(index("m0", bucket(1, REDDIT, null, 10)));
        ctx.scorer().onMinerEvaluated(0, scorableIndex("m0", 10),
            Collections.singletonList(ValidationResult.valid()), 0);
        ctx.scorer().onMinerEvaluated(1, scorableIndex("m1", 10),
            Collections.singletonList(ValidationResult.valid()), 0);

        when(registry.getParticipants()).thenReturn(Arrays.asList(miner(0, "new"), miner(1, "m1")));
        ctx.sync();

        assertEquals(0.5, ctx.scorer().getCredibility(0), 0);
        assertEquals(0, ctx.scorer().getScore(0), 0);
        assertEquals(0.525, ctx.scorer().getCredibility(1), 1e-9);
        assertThat(indexRepo.getIndex("m0"), nullValue());
    }

    @Test(expected = IllegalStateException.class)
    public void ensureParticipantsMustBeOrderedByUid() {
        when(registry.getParticipants()).thenReturn(Arrays.asList(miner(1, "m1"), miner(0, "m0")));
        ctx.sync();
    }

    @Test
    public void ensureStartupFailsIfStateCannotBeLoaded() {
        doThrow(new ApplicationException("corrupt")).when(stateRepo).load();
        try {
            ctx.startup();
            fail("Exception expected");
        } catch (ApplicationException e) {
            assertThat(e.getMessage(), is("corrupt"));
        }
        assertFalse(ctx.isRunning());
    }

    @Test
    public void ensureStateIsRestoredAndSaved() {
        stateRepo.save(new MinerTrustState(new double[]{1, 2, 3}, new double[]{0.9, 0.8, 0.1}));
        when(registry.getParticipants()).thenReturn(Arrays.<Participant>asList(
            validator(0, "v0"), validator(1, "v1"), validator(2, "v2"), validator(3, "v3")));

        ctx.startup();
        assertTrue(ctx.isRunning());
        assertThat(ctx.scorer().size(), is(4));
        assertEquals(2, ctx.scorer().getScore(1), 0);
        assertThat(ctx.scorer().getCredibleMiners(), is(Arrays.asList(0, 1)));
        assertThat(ctx.status().getProperty("participants").getValue(), is((Object) 4));
        assertThat(ctx.status().getProperty("miners").getValue(), is((Object) 0));

        ctx.shutdown();
        assertFalse(ctx.isRunning());
        verify(stateRepo, times(2)).save(any(MinerTrustState.class));
        assertThat(stateRepo.load().size(), is(4));
    }

    @Test
    public void ensureHotkeyReplacedWhileStoppedIsReset() {
        stateRepo.save(new MinerTrustState(new double[]{1, 2}, new double[]{0.9, 0.8}));
        when(registry.getParticipants()).thenReturn(Arrays.<Participant>asList(validator(0, "v0"), validator(1, "v1")));
        ctx.startup();
        ctx.shutdown();
        assertThat(stateRepo.load().getHotkeys(), is(Arrays.asList("v0", "v1")));

        indexRepo.store(index("v0", bucket(1, REDDIT, null, 10)));
        when(registry.getParticipants()).thenReturn(Arrays.<Participant>asList(validator(0, "new"), validator(1, "v1")));
        ValidatorContext restarted = newContext();
        try {
            restarted.startup();

            assertEquals(MinerScorer.STARTING_CREDIBILITY, restarted.scorer().getCredibility(0), 0);
            assertEquals(0, restarted.scorer().getScore(0), 0);
            assertEquals(0.8, restarted.scorer().getCredibility(1), 0);
            assertEquals(2, restarted.scorer().getScore(1), 0);
            assertThat(indexRepo.getIndex("v0"), nullValue());
        } finally {
            restarted.shutdown();
        }
        assertThat(stateRepo.load().getHotkeys(), is(Arrays.asList("new", "v1")));
    }

    @Test
    public void ensureShutdownReleasesEvaluationThreads() {
        when(registry.getParticipants()).thenReturn(Collections.<Participant>emptyList());
        ctx.startup();
        ctx.shutdown();

        assertTrue(ctx.evaluator().isShutdown());
    }

    @Test
    public void ensureUnstartedContextReleasesEvaluationThreads() {
        ctx.shutdown();

        assertTrue(ctx.evaluator().isShutdown());
        verify(stateRepo, never()).save(any(MinerTrustState.class));
    }

    @Test(expected = IllegalStateException.class)
    public void ensureContextCannotBeRestarted() {
        when(registry.getParticipants()).thenReturn(Collections.<Participant>emptyList());
        ctx.startup();
        ctx.shutdown();
        ctx.startup();
    }
}
