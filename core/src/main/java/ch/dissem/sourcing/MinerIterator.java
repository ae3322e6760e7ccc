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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Endlessly cycles through the uids of all miners in ascending order. Thread safe.
 */
public class MinerIterator {
    private List<Integer> uids;
    private int position;

    public MinerIterator(Collection<Integer> uids) {
        this.uids = sorted(uids);
        this.position = 0;
    }

    private static List<Integer> sorted(Collection<Integer> uids) {
        List<Integer> result = new ArrayList<>(uids);
        Collections.sort(result);
        return result;
    }

    public synchronized boolean isEmpty() {
        return uids.isEmpty();
    }

    public synchronized int size() {
        return uids.size();
    }

    /**
     * @return the uid the next call to {@link #next()} will return
     * @throws NoSuchElementException if there are no miners
     */
    public synchronized int peek() {
        if (uids.isEmpty()) {
            throw new NoSuchElementException("No miners");
        }
        return uids.get(position);
    }

    public synchronized int next() {
        int uid = peek();
        position = (position + 1) % uids.size();
        return uid;
    }

    /**
     * Replaces the miners to iterate over. Iteration continues with the first uid that isn't smaller than
     * the one that would have been next.
     */
    public synchronized void setMinerUids(Collection<Integer> newUids) {
        Integer current = uids.isEmpty() ? null : uids.get(position);
        uids = sorted(newUids);
        position = 0;
        if (current != null && !uids.isEmpty()) {
            int index = Collections.binarySearch(uids, current);
            if (index < 0) {
                index = -index - 1;
            }
            position = index % uids.size();
        }
    }
}
