package io.netsim.topology.analysis;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Bandwidth buckets, upper bounds exclusive.
public enum BandwidthClass {
    LOW(100),
    MEDIUM(1_000),
    HIGH(10_000),
    ULTRA(Integer.MAX_VALUE);

    private final int upperBoundMbps;

    BandwidthClass(int upperBoundMbps) {
        this.upperBoundMbps = upperBoundMbps;
    }

    public static BandwidthClass of(int bandwidthMbps) {
        for (BandwidthClass bucket : values()) {
            if (bandwidthMbps < bucket.upperBoundMbps) {
                return bucket;
            }
        }
        return ULTRA;
    }
}
