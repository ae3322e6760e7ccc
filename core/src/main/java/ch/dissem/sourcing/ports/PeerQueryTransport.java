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

package ch.dissem.sourcing.ports;

import ch.dissem.sourcing.entity.DataEntityBucketResponse;
import ch.dissem.sourcing.entity.MinerIndexResponse;
import ch.dissem.sourcing.entity.Participant;
import ch.dissem.sourcing.entity.valueobject.DataEntityBucketId;

import java.util.concurrent.Future;

/**
 * Sends requests to miners. Implementations should never block the caller; failures are reported either by
 * an unsuccessful response or by a future that completes exceptionally (e.g. with a
 * {@link ch.dissem.sourcing.exception.NodeException}).
 */
public interface PeerQueryTransport {
    Future<MinerIndexResponse> requestIndex(Participant miner, long timeoutSeconds);

    Future<DataEntityBucketResponse> requestBucket(Participant miner, DataEntityBucketId bucket, long timeoutSeconds);
}
