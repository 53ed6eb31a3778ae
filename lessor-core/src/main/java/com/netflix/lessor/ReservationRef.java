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
 * A handle to a reservation owned by the actor kernel. Calendars index these handles and allocators read their
 * resources to exclude what is already committed; neither ever changes a reservation's state.
 */
public interface ReservationRef {

    /**
     * Get the identifier of this reservation. Identifiers are unique and totally ordered, and are used to break
     * ties between reservations that otherwise sort equally.
     *
     * @return the reservation identifier
     */
    String getReservationId();

    /**
     * Get the type of resource this reservation is for. Used to filter holdings queries.
     *
     * @return the resource type, or null
     */
    String getResourceType();

    ReservationState getState();

    PendingState getPendingState();

    /**
     * Get the resources this reservation currently holds.
     *
     * @return current resources, or null
     */
    ReservationResources getResources();

    /**
     * Get the resources most recently requested for this reservation, for example the new terms of an extension.
     *
     * @return requested resources, or null
     */
    ReservationResources getRequestedResources();

    /**
     * Get the resources approved for this reservation while a ticket is being issued.
     *
     * @return approved resources, or null
     */
    ReservationResources getApprovedResources();

    default boolean isActive() {
        return getState() == ReservationState.Active || getState() == ReservationState.ActiveTicketed;
    }

    default boolean isTicketed() {
        return getState() == ReservationState.Ticketed;
    }

    default boolean isTicketing() {
        return getPendingState() == PendingState.Ticketing;
    }

    default boolean isExtendingTicket() {
        return getPendingState() == PendingState.ExtendingTicket;
    }

    default boolean isClosed() {
        return getState() == ReservationState.Closed;
    }

    default boolean isFailed() {
        return getState() == ReservationState.Failed;
    }
}
