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
 * The outcome of one allocation attempt against one candidate: either the annotated value together with the
 * identifier of the delegation it was drawn from, or an {@link AllocationFailure}.
 *
 * @param <T> the type of the allocated value
 */
public class AllocationResult<T> {
    private final T value;
    private final String delegationId;
    private final AllocationFailure failure;

    private AllocationResult(T value, String delegationId, AllocationFailure failure) {
        this.value = value;
        this.delegationId = delegationId;
        this.failure = failure;
    }

    public static <T> AllocationResult<T> success(T value) {
        return new AllocationResult<>(value, null, null);
    }

    public static <T> AllocationResult<T> success(T value, String delegationId) {
        return new AllocationResult<>(value, delegationId, null);
    }

    public static <T> AllocationResult<T> error(AllocationFailure failure) {
        return new AllocationResult<>(null, null, failure);
    }

    public static <T> AllocationResult<T> error(FailureKind kind, String message) {
        return error(new AllocationFailure(kind, message));
    }

    public boolean isSuccessful() {
        return failure == null;
    }

    public boolean hasFailure() {
        return failure != null;
    }

    public AllocationFailure getFailure() {
        return failure;
    }

    /**
     * Get the identifier of the delegation the allocation was drawn from, if the allocation consumed a delegated
     * pool.
     *
     * @return the delegation identifier, or null
     */
    public String getDelegationId() {
        return delegationId;
    }

    /**
     * Get the allocated value.
     *
     * @return the allocated value
     * @throws AllocationException if this result holds a failure
     */
    public T get() throws AllocationException {
        if (failure != null)
            throw new AllocationException(failure);
        return value;
    }

    /**
     * Get the allocated value, or null if this result holds a failure.
     *
     * @return the allocated value or null
     */
    public T getValue() {
        return value;
    }

    @Override
    public String toString() {
        return failure == null ?
                "AllocationResult{delegationId=" + delegationId + ", value=" + value + '}' :
                "AllocationResult{" + failure + '}';
    }
}
