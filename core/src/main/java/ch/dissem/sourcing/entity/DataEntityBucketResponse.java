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
import java.util.Collections;
import java.util.List;

/**
 * A miner's answer to a request for the content of one bucket.
 */
public class DataEntityBucketResponse implements Serializable {
    private static final long serialVersionUID = 4416080873946162284L;

    private final boolean success;
    private final List<DataEntity> entities;

    public DataEntityBucketResponse(boolean success, List<DataEntity> entities) {
        this.success = success;
        this.entities = entities == null ? null : Collections.unmodifiableList(entities);
    }

    public static DataEntityBucketResponse success(List<DataEntity> entities) {
        return new DataEntityBucketResponse(true, entities);
    }

    public static DataEntityBucketResponse failure() {
        return new DataEntityBucketResponse(false, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public List<DataEntity> getEntities() {
        return entities;
    }

    public static boolean isValid(DataEntityBucketResponse response) {
        return response != null && response.success && response.entities != null;
    }
}
