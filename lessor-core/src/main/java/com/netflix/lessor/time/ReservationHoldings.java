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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A collection of reservations, each associated with a validity interval. Answers intersection queries: which
 * reservations are valid at a given instant.
 * <P>
 * As time goes by, records that can no longer intersect a query are purged by {@link #tick(long)}. Purging keeps
 * queries cheap, since a query scans every entry that ends at or after the query time.
 * <P>
 * This implementation provides {@code O(logN)} lookup of the insertion point for add and remove, and
 * {@code O(logN+M)} performance for queries, where {@code M} is the number of entries ending at or after the query
 * time. Each reservation appears at most once; adding it again replaces its interval.
 * <P>
 * This implementation is not synchronized. Invocations of methods of this class must be synchronized externally if
 * there is a chance of calling them concurrently.
 */
public class ReservationHoldings {
    private static final Logger logger = LoggerFactory.getLogger(ReservationHoldings.class);
    // sorted by increasing end time, then reservation id
    private final List<ReservationWrapper> list = new ArrayList<>();
    private final Map<String, ReservationWrapper> map = new HashMap<>();
    private final ReservationSet reservations = new ReservationSet();

    /**
     * Add a reservation for the given interval, closed on both sides. If the reservation is already present, this
     * is an extension: the new interval must begin no later than one time unit after the previous one ended, and
     * the reservation keeps its original start.
     *
     * @param reservation the reservation
     * @param start start time
     * @param end end time
     * @throws IllegalStateException if the new interval is not contiguous with the previous one
     */
    public void add(ReservationRef reservation, long start, long end) {
        long myStart = start;
        final ReservationWrapper existing = map.get(reservation.getReservationId());
        if (existing != null) {
            if (start - existing.getEnd() > 1)
                throw new IllegalStateException("Reservation " + reservation.getReservationId() +
                        " extended with a gap: previous end=" + existing.getEnd() + ", new start=" + start);
            myStart = existing.getStart();
            remove(reservation);
        }
        final ReservationWrapper entry = new ReservationWrapper(reservation, myStart, end);
        list.add(insertionPoint(entry), entry);
        map.put(reservation.getReservationId(), entry);
        reservations.add(reservation);
    }

    /**
     * Remove a reservation. Removing a reservation that is not present does nothing.
     *
     * @param reservation the reservation
     */
    public void remove(ReservationRef reservation) {
        final ReservationWrapper entry = map.remove(reservation.getReservationId());
        if (entry == null)
            return;
        reservations.remove(reservation);
        final int index = Collections.binarySearch(list, entry, ReservationWrapper.BY_END);
        if (index >= 0)
            list.remove(index);
        else
            logger.warn("Unexpected: holdings entry " + entry + " missing from the sorted list");
    }

    /**
     * Get all reservations in this collection.
     *
     * @return a copy of the reservations
     */
    public ReservationSet getReservations() {
        return reservations.copy();
    }

    /**
     * Get the reservations whose interval contains the given time.
     *
     * @param time the time instant
     * @return the reservations valid at that time
     */
    public ReservationSet getReservations(long time) {
        return getReservations(time, null);
    }

    /**
     * Get the reservations of the given resource type whose interval contains the given time.
     *
     * @param time the time instant
     * @param type resource type to match, or null to match any type
     * @return the reservations valid at that time
     */
    public ReservationSet getReservations(long time, String type) {
        final ReservationSet result = new ReservationSet();
        final int index = insertionPoint(ReservationWrapper.key(time));
        // entries from the insertion point on end at or after time, but may start after it
        for (int i = index; i < list.size(); i++) {
            final ReservationWrapper entry = list.get(i);
            if (entry.contains(time) && matches(entry, type))
                result.add(entry.getReservation());
        }
        for (int i = index - 1; i >= 0; i--) {
            final ReservationWrapper entry = list.get(i);
            if (entry.getEnd() < time)
                break;
            if (entry.contains(time) && matches(entry, type))
                result.add(entry.getReservation());
        }
        return result;
    }

    private static boolean matches(ReservationWrapper entry, String type) {
        return type == null || type.equals(entry.getReservation().getResourceType());
    }

    /**
     * Remove every reservation whose interval ends at or before the given time.
     *
     * @param time the time
     */
    public void tick(long time) {
        int expired = 0;
        while (expired < list.size() && list.get(expired).getEnd() <= time) {
            final ReservationWrapper entry = list.get(expired);
            map.remove(entry.getReservation().getReservationId());
            reservations.remove(entry.getReservation());
            expired++;
        }
        if (expired > 0) {
            list.subList(0, expired).clear();
            logger.debug("Purged " + expired + " holdings ending at or before " + time);
        }
    }

    public int size() {
        return reservations.size();
    }

    public void clear() {
        list.clear();
        map.clear();
        reservations.clear();
    }

    private int insertionPoint(ReservationWrapper entry) {
        final int i = Collections.binarySearch(list, entry, ReservationWrapper.BY_END);
        if (i >= 0)
            return i;
        return -i - 1;
    }
}
