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

package ch.dissem.sourcing.entity;

import ch.dissem.sourcing.utils.Encode;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

public class MinerTrustStateTest {
    @Test
    public void ensureStateIsWrittenAndReadCorrectly() throws Exception {
        MinerTrustState state = new MinerTrustState(
            new double[]{0, 1.378125, 1e-300, 123456.789},
            new double[]{0.5, 0.525, 0.8, 1}
        );

        MinerTrustState read = MinerTrustState.read(new ByteArrayInputStream(Encode.bytes(state)));

        assertThat(read.size(), is(4));
        assertArrayEquals(state.getScores(), read.getScores(), 1e-9);
        assertArrayEquals(state.getCredibility(), read.getCredibility(), 1e-9);
        assertThat(read, is(state));
    }

    @Test
    public void ensureEmptyStateCanBeStored() throws Exception {
        MinerTrustState state = new MinerTrustState(new double[0], new double[0]);
        byte[] data = Encode.bytes(state);
        assertThat(data.length, is(3));
        assertThat(MinerTrustState.read(new ByteArrayInputStream(data)).size(), is(0));
    }

    @Test(expected = EOFException.class)
    public void ensureTruncatedStateIsRejected() throws Exception {
        byte[] data = Encode.bytes(new MinerTrustState(new double[]{1, 2}, new double[]{0.5, 0.5}));
        MinerTrustState.read(new ByteArrayInputStream(Arrays.copyOf(data, data.length - 3)));
    }

    @Test(expected = IOException.class)
    public void ensureUnknownVersionIsRejected() throws Exception {
        MinerTrustState.read(new ByteArrayInputStream(new byte[]{3, 0}));
    }

    @Test
    public void ensureHotkeysAreStored() throws Exception {
        MinerTrustState state = new MinerTrustState(new double[]{1, 2, 3}, new double[]{0.5, 0.6, 0.7},
            Arrays.asList("5F3sa2TJ", "5Hgx\u00e9"));

        MinerTrustState read = MinerTrustState.read(new ByteArrayInputStream(Encode.bytes(state)));

        assertThat(read.getHotkeys(), is(Arrays.asList("5F3sa2TJ", "5Hgx\u00e9")));
        assertThat(read, is(state));
    }

    @Test
    public void ensureStateWithoutHotkeysCanBeRead() throws Exception {
        byte[] data = {1, 1, 0x3f, (byte) 0xf0, 0, 0, 0, 0, 0, 0, 0x3f, (byte) 0xe0, 0, 0, 0, 0, 0, 0};

        MinerTrustState read = MinerTrustState.read(new ByteArrayInputStream(data));

        assertThat(read.size(), is(1));
        assertArrayEquals(new double[]{1}, read.getScores(), 0);
        assertArrayEquals(new double[]{0.5}, read.getCredibility(), 0);
        assertThat(read.getHotkeys(), is(Collections.<String>emptyList()));
    }

    @Test(expected = IOException.class)
    public void ensureMoreHotkeysThanMinersAreRejected() throws Exception {
        MinerTrustState.read(new ByteArrayInputStream(new byte[]{2, 0, 1, 1, 'a'}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void ensureHotkeysMustNotOutnumberMiners() {
        new MinerTrustState(new double[1], new double[1], Arrays.asList("a", "b"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void ensureArraysMustHaveTheSameLength() {
        new MinerTrustState(new double[2], new double[3]);
    }
}
