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

import ch.dissem.sourcing.utils.Decode;
import ch.dissem.sourcing.utils.Encode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Snapshot of the scores and credibility of all miners, indexed by uid, together with the hotkeys the uids
 * belonged to when the snapshot was taken.
 */
public class MinerTrustState implements Streamable {
    private static final long serialVersionUID = 2049582210187264520L;

    public static final int VERSION = 2;
    private static final int VERSION_WITHOUT_HOTKEYS = 1;

    private final double[] scores;
    private final double[] credibility;
    private final List<String> hotkeys;

    public MinerTrustState(double[] scores, double[] credibility) {
        this(scores, credibility, Collections.<String>emptyList());
    }

    /**
     * @param hotkeys hotkeys by uid, may be shorter than the score table if the population shrank
     */
    public MinerTrustState(double[] scores, double[] credibility, List<String> hotkeys) {
        if (scores.length != credibility.length) {
            throw new IllegalArgumentException("Got " + scores.length + " scores but "
                + credibility.length + " credibility values");
        }
        if (hotkeys.size() > scores.length) {
            throw new IllegalArgumentException("Got " + hotkeys.size() + " hotkeys for "
                + scores.length + " miners");
        }
        this.scores = Arrays.copyOf(scores, scores.length);
        this.credibility = Arrays.copyOf(credibility, credibility.length);
        this.hotkeys = Collections.unmodifiableList(new ArrayList<>(hotkeys));
    }

    public MinerTrustState withHotkeys(List<String> hotkeys) {
        return new MinerTrustState(scores, credibility, hotkeys);
    }

    public int size() {
        return scores.length;
    }

    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    public double[] getCredibility() {
        return Arrays.copyOf(credibility, credibility.length);
    }

    /**
     * @return the hotkeys by uid, empty if they weren't known when the state was saved
     */
    public List<String> getHotkeys() {
        return hotkeys;
    }

    @Override
    public void write(OutputStream out) throws IOException {
        Encode.varInt(VERSION, out);
        Encode.varInt(scores.length, out);
        for (double score : scores) {
            Encode.float64(score, out);
        }
        for (double c : credibility) {
            Encode.float64(c, out);
        }
        Encode.varInt(hotkeys.size(), out);
        for (String hotkey : hotkeys) {
            Encode.varString(hotkey, out);
        }
    }

    public static MinerTrustState read(InputStream in) throws IOException {
        long version = Decode.varInt(in);
        if (version != VERSION && version != VERSION_WITHOUT_HOTKEYS) {
            throw new IOException("Unsupported miner trust state version " + version);
        }
        long length = Decode.varInt(in);
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new IOException("Invalid number of miners: " + length);
        }
        int n = (int) length;
        double[] scores = new double[n];
        double[] credibility = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = Decode.float64(in);
        }
        for (int i = 0; i < n; i++) {
            credibility[i] = Decode.float64(in);
        }
        if (version == VERSION_WITHOUT_HOTKEYS) {
            return new MinerTrustState(scores, credibility);
        }
        long hotkeyCount = Decode.varInt(in);
        if (hotkeyCount < 0 || hotkeyCount > n) {
            throw new IOException("Invalid number of hotkeys: " + hotkeyCount);
        }
        List<String> hotkeys = new ArrayList<>((int) hotkeyCount);
        for (int i = 0; i < hotkeyCount; i++) {
            hotkeys.add(Decode.varString(in));
        }
        return new MinerTrustState(scores, credibility, hotkeys);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MinerTrustState)) return false;
        MinerTrustState that = (MinerTrustState) o;
        return Arrays.equals(scores, that.scores) && Arrays.equals(credibility, that.credibility)
            && hotkeys.equals(that.hotkeys);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(scores) + Arrays.hashCode(credibility)) + hotkeys.hashCode();
    }

    @Override
    public String toString() {
        return "MinerTrustState{" + scores.length + " miners}";
    }
}
