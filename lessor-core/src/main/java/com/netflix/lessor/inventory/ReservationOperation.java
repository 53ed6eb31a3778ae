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

package com.netflix.lessor.inventory;

/**
 * The reservation operation an allocation is performed for.
 */
public enum ReservationOperation {
    /**
     * A new reservation: every component is matched and labelled.
     */
    Create,
    /**
     * A change to an existing reservation: components already bound keep their binding.
     */
    Modify,
    /**
     * A renewal: components already bound must still be exclusively available.
     */
    Extend
}
