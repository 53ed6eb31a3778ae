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

package com.netflix.lessor.time;

import com.netflix.lessor.ReservationRef;
import com.netflix.lessor.ReservationSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maintains reservations grouped by the cycle with which they are associated, such as the cycle by which they
 * must be renewed or closed. A reservation is associated with at most one cycle at a time.
 * <P>
 * Buckets are kept both in a list sorted by cycle and in a map keyed by cycle. The map makes lookups and removals
 * constant time; the sorted list makes reclaiming all buckets up to a cycle proportional to the number reclaimed.
 * The first insert into a new cycle costs {@code O(log(cycles))}, later inserts into that cycle and removals are
 * {@code O(1)}. A bucket emptied by {@link #remove(ReservationRef)} leaves the map at once and the sorted list at
 * the next {@link #tick(long)} that reaches its cycle; a new insert into that cycle reuses it, so the sorted list
 * holds at most one bucket per cycle.
 * <P>
 * This implementation is not synchronized. Invocations of methods of this class must be synchronized externally if
 * there is a chance of calling them concurrently.
 */
public class ReservationList {

    private static class CycleBucket {
        private final long cycle;
        private final ReservationSet reservations = new ReservationSet();

        private CycleBucket(long cycle) {
            this.cycle = cycle;
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(ReservationList.class);
    private final List<CycleBucket> buckets = new ArrayList<>();
    private final Map<Long, CycleBucket> cycleToBucket = new HashMap<>();
    private final Map<String, Long> reservationToCycle = new HashMap<>();
    private int count = 0;

    /**
     * Associate a reservation with a cycle. Adding a reservation again with the same cycle does nothing.
     *
     * @param reservation the reservation
     * @param cycle the cycle
     * @throws IllegalArgumentException if the reservation or its identifier is null, or the cycle is negative
     * @throws IllegalStateException if the reservation is already associated with a different cycle
     */
    public void add(ReservationRef reservation, long cycle) {
        if (reservation == null || reservation.getReservationId() == null || cycle < 0)
            throw new IllegalArgumentException("Invalid arguments: reservation=" + reservation + ", cycle=" + cycle);
        final Long existing = reservationToCycle.get(reservation.getReservationId());
        if (existing != null) {
            if (existing == cycle)
                return;
            throw new IllegalStateException("Reservation " + reservation.getReservationId() +
                    " is already in the list at cycle " + existing + ", remove it before adding it at cycle " + cycle);
        }
        CycleBucket bucket = cycleToBucket.get(cycle);
        if (bucket == null) {
            final int i = insertionPoint(cycle);
            if (i > 0 && buckets.get(i - 1).cycle == cycle) {
                bucket = buckets.get(i - 1);
            } else {
                bucket = new CycleBucket(cycle);
                buckets.add(i, bucket);
            }
            cycleToBucket.put(cycle, bucket);
        }
        bucket.reservations.add(reservation);
        reservationToCycle.put(reservation.getReservationId(), cycle);
        count++;
    }

    /**
     * Remove a reservation from the list. Removing a reservation that is not present does nothing.
     *
     * @param reservation the reservation
     */
    public void remove(ReservationRef reservation) {
        final Long cycle = reservationToCycle.remove(reservation.getReservationId());
        if (cycle == null)
            return;
        final CycleBucket bucket = cycleToBucket.get(cycle);
        if (bucket == null) {
            logger.warn("Unexpected: no bucket for cycle " + cycle + " holding reservation " +
                    reservation.getReservationId());
            return;
        }
        bucket.reservations.remove(reservation);
        count--;
        if (bucket.reservations.isEmpty())
            cycleToBucket.remove(cycle);
    }

    /**
     * Get the reservations associated with exactly the given cycle.
     *
     * @param cycle the cycle
     * @return a copy of the reservations in that cycle
     */
    public ReservationSet getReservations(long cycle) {
        final CycleBucket bucket = cycleToBucket.get(cycle);
        return bucket == null ? new ReservationSet() : bucket.reservations.copy();
    }

    /**
     * Get the reservations associated with any cycle up to and including the given cycle.
     *
     * @param cycle the cycle
     * @return a new set of the reservations due by that cycle
     */
    public ReservationSet getAllReservations(long cycle) {
        final ReservationSet result = new ReservationSet();
        for (CycleBucket bucket : buckets) {
            if (bucket.cycle > cycle)
                break;
            result.addAll(bucket.reservations);
        }
        return result;
    }

    /**
     * Reclaim every bucket associated with a cycle up to and including the given cycle.
     *
     * @param cycle the cycle
     * @return the reclaimed reservations, in ascending cycle order
     */
    public ReservationSet tick(long cycle) {
        final ReservationSet reclaimed = new ReservationSet();
        int n = 0;
        while (n < buckets.size() && buckets.get(n).cycle <= cycle) {
            final CycleBucket bucket = buckets.get(n);
            if (cycleToBucket.get(bucket.cycle) == bucket)
                cycleToBucket.remove(bucket.cycle);
            for (ReservationRef r : bucket.reservations)
                reservationToCycle.remove(r.getReservationId());
            count -= bucket.reservations.size();
            reclaimed.addAll(bucket.reservations);
            n++;
        }
        if (n > 0) {
            buckets.subList(0, n).clear();
            logger.debug("Reclaimed " + reclaimed.size() + " reservations from " + n + " buckets up to cycle " + cycle);
        }
        return reclaimed;
    }

    /**
     * Get the number of reservations in this list.
     *
     * @return the number of reservations
     */
    public int size() {
        return count;
    }

    int bucketCount() {
        return buckets.size();
    }

    private int insertionPoint(long cycle) {
        int low = 0;
        int high = buckets.size();
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (buckets.get(mid).cycle <= cycle)
                low = mid + 1;
            else
                high = mid;
        }
        return low;
    }
}
