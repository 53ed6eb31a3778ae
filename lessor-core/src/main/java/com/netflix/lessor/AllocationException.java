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
 * Thrown by {@link AllocationResult#get()} when the result holds a failure instead of a value.
 */
public class AllocationException extends Exception {

    private final AllocationFailure failure;

    public AllocationException(AllocationFailure failure) {
        super(failure.getKind() + ": " + failure.getMessage());
        this.failure = failure;
    }

    public AllocationFailure getFailure() {
        return failure;
    }

    public FailureKind getKind() {
        return failure.getKind();
    }
}
