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

import com.netflix.lessor.ReservationRef;
import com.netflix.lessor.ReservationResources;
import com.netflix.lessor.slivers.BaseSliver;
import com.netflix.lessor.slivers.Capacities;
import com.netflix.lessor.slivers.Delegation;
import com.netflix.lessor.slivers.Delegations;
import com.netflix.lessor.slivers.Labels;

final class AllocatedSlivers {

    private AllocatedSlivers() {
    }

    /**
     * Get the sliver through which an existing reservation holds resources: the approved sliver while ticketing,
     * the current sliver once active or ticketed, and the requested sliver while extending its ticket.
     *
     * @param reservation an existing reservation
     * @return the sliver holding resources, or null if the reservation holds none
     */
    static BaseSliver of(ReservationRef reservation) {
        if (reservation.isTicketing())
            return sliver(reservation.getApprovedResources());
        if (reservation.isExtendingTicket())
            return sliver(reservation.getRequestedResources());
        if (reservation.isActive() || reservation.isTicketed())
            return sliver(reservation.getResources());
        return null;
    }

    private static BaseSliver sliver(ReservationResources resources) {
        return resources == null ? null : resources.getSliver();
    }

    /**
     * Get the label pool a substrate element offers: its first label delegation, or its own labels if it carries
     * no delegation.
     */
    static Labels poolLabels(BaseSliver sliver) {
        final Delegation<Labels> delegation = Delegations.first(sliver.getLabelDelegations());
        if (delegation != null && delegation.getPool() != null)
            return delegation.getPool();
        return sliver.getLabels() == null ? Labels.EMPTY : sliver.getLabels();
    }

    static Capacities poolCapacities(BaseSliver sliver) {
        final Delegation<Capacities> delegation = Delegations.first(sliver.getCapacityDelegations());
        if (delegation != null && delegation.getPool() != null)
            return delegation.getPool();
        return sliver.getCapacities() == null ? Capacities.EMPTY : sliver.getCapacities();
    }

    static Labels labelsOrEmpty(Labels labels) {
        return labels == null ? Labels.EMPTY : labels;
    }
}
