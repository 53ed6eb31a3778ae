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

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A set of reservations keyed by reservation identifier, iterated in insertion order. Two handles with the same
 * identifier are the same member of the set, regardless of object identity.
 * <P>
 * This implementation is not synchronized. Calendars hand out copies, so a set obtained from a calendar can be
 * iterated without holding the calendar's lock.
 */
public class ReservationSet implements Iterable<ReservationRef> {
    private final Map<String, ReservationRef> reservations;

    public ReservationSet() {
        reservations = new LinkedHashMap<>();
    }

    private ReservationSet(Map<String, ReservationRef> reservations) {
        this.reservations = new LinkedHashMap<>(reservations);
    }

    /**
     * Add a reservation, replacing any member with the same identifier.
     *
     * @param reservation the reservation to add
     * @return true if no reservation with this identifier was present before
     */
    public boolean add(ReservationRef reservation) {
        return reservations.put(reservation.getReservationId(), reservation) == null;
    }

    public void addAll(ReservationSet other) {
        reservations.putAll(other.reservations);
    }

    public boolean remove(ReservationRef reservation) {
        return reservations.remove(reservation.getReservationId()) != null;
    }

    public boolean contains(ReservationRef reservation) {
        return reservations.containsKey(reservation.getReservationId());
    }

    public boolean contains(String reservationId) {
        return reservations.containsKey(reservationId);
    }

    public ReservationRef get(String reservationId) {
        return reservations.get(reservationId);
    }

    public int size() {
        return reservations.size();
    }

    public boolean isEmpty() {
        return reservations.isEmpty();
    }

    public void clear() {
        reservations.clear();
    }

    public Collection<ReservationRef> values() {
        return Collections.unmodifiableCollection(reservations.values());
    }

    /**
     * Create an independent copy of this set. Changes to the copy are not reflected in this set, and vice versa.
     *
     * @return a copy of this set
     */
    public ReservationSet copy() {
        return new ReservationSet(reservations);
    }

    @Override
    public Iterator<ReservationRef> iterator() {
        return values().iterator();
    }

    @Override
    public String toString() {
        return "ReservationSet" + reservations.keySet();
    }
}
