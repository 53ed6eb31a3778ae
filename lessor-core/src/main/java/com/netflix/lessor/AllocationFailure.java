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

package com.netflix.lessor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Describes why a reservation could not be satisfied from a candidate substrate element. For capacity
 * shortfalls, {@link #getResources()} names the fields that would have gone negative.
 * <p>
 * Allocators return failures as part of an {@link AllocationResult}. The policy layer that invoked the allocator
 * decides whether to try a different candidate or to report the failure back to the requesting actor.
 */
public class AllocationFailure {

    private final FailureKind kind;
    private final String message;
    private final List<String> resources;

    @JsonCreator
    @JsonIgnoreProperties(ignoreUnknown=true)
    public AllocationFailure(@JsonProperty("kind") FailureKind kind,
                             @JsonProperty("message") String message,
                             @JsonProperty("resources") List<String> resources) {
        this.kind = kind;
        this.message = message;
        this.resources = resources == null ? Collections.emptyList() : Collections.unmodifiableList(resources);
    }

    public AllocationFailure(FailureKind kind, String message) {
        this(kind, message, null);
    }

    /**
     * Returns the kind of this failure.
     *
     * @return the failure kind
     */
    public FailureKind getKind() {
        return kind;
    }

    /**
     * Returns a human-readable description of what was short or mismatched.
     *
     * @return the failure message
     */
    public String getMessage() {
        return message;
    }

    /**
     * Returns the names of the resources that were short, if the failure concerns quantifiable resources.
     *
     * @return resource names, possibly empty
     */
    public List<String> getResources() {
        return resources;
    }

    @Override
    public String toString() {
        return "AllocationFailure{" +
                "kind=" + kind +
                ", message='" + message + '\'' +
                ", resources=" + resources +
                '}';
    }
}
