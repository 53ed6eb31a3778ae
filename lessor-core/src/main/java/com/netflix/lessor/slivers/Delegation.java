/*
 * Copyright 2016 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.lessor.slivers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named pool of capacities or labels advertised by a substrate element, scoped by its delegation identifier.
 *
 * @param <T> {@link Capacities} or {@link Labels}
 */
public class Delegation<T> {
    private final String delegationId;
    private final T pool;

    @JsonCreator
    public Delegation(@JsonProperty("delegationId") String delegationId, @JsonProperty("pool") T pool) {
        this.delegationId = delegationId;
        this.pool = pool;
    }

    public String getDelegationId() {
        return delegationId;
    }

    public T getPool() {
        return pool;
    }

    @Override
    public String toString() {
        return delegationId + "=" + pool;
    }
}
