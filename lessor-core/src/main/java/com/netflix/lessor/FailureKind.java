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

/**
 * The kinds of failure an allocation attempt can end with.
 */
public enum FailureKind {
    /**
     * The request or the candidate was malformed or missing required input, such as a capacity delegation.
     */
    InvalidArgument,
    /**
     * Capacity, components, or address space were exhausted on the candidate.
     */
    InsufficientResources,
    /**
     * A structural mismatch, such as a sliver of the wrong type, a missing sub-structure, or a label outside its
     * delegated range.
     */
    Failure
}
