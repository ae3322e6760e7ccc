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

import java.io.Serializable;

/**
 * A miner's answer to an index request.
 */
public class MinerIndexResponse implements Serializable {
    private static final long serialVersionUID = -2785946301208851447L;

    private final boolean success;
    private final MinerIndex index;

    public MinerIndexResponse(boolean success, MinerIndex index) {
        this.success = success;
        this.index = index;
    }

    public static MinerIndexResponse success(MinerIndex index) {
        return new MinerIndexResponse(true, index);
    }

    public static MinerIndexResponse failure() {
        return new MinerIndexResponse(false, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public MinerIndex getIndex() {
        return index;
    }

    public static boolean isValid(MinerIndexResponse response) {
        return response != null && response.success && response.index != null;
    }
}
