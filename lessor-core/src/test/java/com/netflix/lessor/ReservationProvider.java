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

import com.netflix.lessor.slivers.BaseSliver;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ReservationProvider {

    public static class TestReservation implements ReservationRef {
        private final String id;
        private final String type;
        private ReservationState state = ReservationState.Nascent;
        private PendingState pendingState = PendingState.None;
        private ReservationResources resources;
        private ReservationResources requested;
        private ReservationResources approved;

        public TestReservation(String id, String type) {
            this.id = id;
            this.type = type;
        }

        @Override
        public String getReservationId() {
            return id;
        }

        @Override
        public String getResourceType() {
            return type;
        }

        @Override
        public ReservationState getState() {
            return state;
        }

        @Override
        public PendingState getPendingState() {
            return pendingState;
        }

        @Override
        public ReservationResources getResources() {
            return resources;
        }

        @Override
        public ReservationResources getRequestedResources() {
            return requested;
        }

        @Override
        public ReservationResources getApprovedResources() {
            return approved;
        }

        public TestReservation withState(ReservationState state, PendingState pendingState) {
            this.state = state;
            this.pendingState = pendingState;
            return this;
        }

        @Override
        public String toString() {
            return id;
        }
    }

    public static TestReservation getReservation(String id) {
        return new TestReservation(id, "vm");
    }

    public static TestReservation getReservation(String id, String type) {
        return new TestReservation(id, type);
    }

    public static TestReservation getActive(String id, BaseSliver sliver) {
        final TestReservation r = getReservation(id).withState(ReservationState.Active, PendingState.None);
        r.resources = resourcesOf(sliver);
        return r;
    }

    public static TestReservation getTicketing(String id, BaseSliver approved) {
        final TestReservation r = getReservation(id).withState(ReservationState.Nascent, PendingState.Ticketing);
        r.approved = resourcesOf(approved);
        return r;
    }

    public static TestReservation getExtending(String id, BaseSliver current, BaseSliver requested) {
        final TestReservation r = getReservation(id).withState(ReservationState.Ticketed, PendingState.ExtendingTicket);
        r.resources = resourcesOf(current);
        r.requested = resourcesOf(requested);
        return r;
    }

    public static TestReservation getClosed(String id, BaseSliver sliver) {
        final TestReservation r = getReservation(id).withState(ReservationState.Closed, PendingState.None);
        r.resources = resourcesOf(sliver);
        return r;
    }

    public static ReservationResources resourcesOf(BaseSliver sliver) {
        final ReservationResources resources = mock(ReservationResources.class);
        when(resources.getSliver()).thenReturn(sliver);
        return resources;
    }
}
