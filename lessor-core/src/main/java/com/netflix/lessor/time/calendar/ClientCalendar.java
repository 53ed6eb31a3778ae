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

package com.netflix.lessor.time.calendar;

import com.netflix.lessor.ReservationRef;
import com.netflix.lessor.ReservationSet;
import com.netflix.lessor.time.ActorClock;
import com.netflix.lessor.time.ReservationHoldings;
import com.netflix.lessor.time.ReservationList;

import java.util.Date;

/**
 * Calendar of a client actor. Keeps the following lists:
 * <UL>
 *     <LI>demand: reservations the client wants but has not yet requested</LI>
 *     <LI>pending: reservations with an outstanding request</LI>
 *     <LI>renewing: reservations grouped by the cycle by which they must be renewed</LI>
 *     <LI>holdings: reservations currently held, indexed by real time</LI>
 * </UL>
 */
public class ClientCalendar extends BaseCalendar {
    private final ReservationSet demand = new ReservationSet();
    private final ReservationSet pending = new ReservationSet();
    private final ReservationList renewing = new ReservationList();
    private final ReservationHoldings holdings = new ReservationHoldings();

    public ClientCalendar(ActorClock clock) {
        super(clock);
    }

    @Override
    public void remove(ReservationRef reservation) {
        lock.lock();
        try {
            removeScheduledOrInProgress(reservation);
            holdings.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeScheduledOrInProgress(ReservationRef reservation) {
        lock.lock();
        try {
            demand.remove(reservation);
            pending.remove(reservation);
            renewing.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getDemand() {
        lock.lock();
        try {
            return demand.copy();
        } finally {
            lock.unlock();
        }
    }

    public void addDemand(ReservationRef reservation) {
        lock.lock();
        try {
            demand.add(reservation);
        } finally {
            lock.unlock();
        }
    }

    public void removeDemand(ReservationRef reservation) {
        lock.lock();
        try {
            demand.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getPending() {
        lock.lock();
        try {
            return pending.copy();
        } finally {
            lock.unlock();
        }
    }

    public void addPending(ReservationRef reservation) {
        lock.lock();
        try {
            pending.add(reservation);
        } finally {
            lock.unlock();
        }
    }

    public void removePending(ReservationRef reservation) {
        lock.lock();
        try {
            pending.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the reservations that must be renewed by the given cycle.
     *
     * @param cycle the cycle
     * @return reservations due for renewal up to and including that cycle
     */
    public ReservationSet getRenewing(long cycle) {
        lock.lock();
        try {
            return renewing.getAllReservations(cycle);
        } finally {
            lock.unlock();
        }
    }

    public void addRenewing(ReservationRef reservation, long cycle) {
        lock.lock();
        try {
            renewing.add(reservation, cycle);
        } finally {
            lock.unlock();
        }
    }

    public void removeRenewing(ReservationRef reservation) {
        lock.lock();
        try {
            renewing.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getHoldings() {
        lock.lock();
        try {
            return holdings.getReservations();
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getHoldings(Date when) {
        return getHoldings(when, null);
    }

    /**
     * Get the reservations of the given resource type held at the given time.
     *
     * @param when the time instant
     * @param type the resource type, or null for every type
     * @return reservations held at that time
     */
    public ReservationSet getHoldings(Date when, String type) {
        final long time = millis(when);
        lock.lock();
        try {
            return holdings.getReservations(time, type);
        } finally {
            lock.unlock();
        }
    }

    public void addHoldings(ReservationRef reservation, Date start, Date end) {
        final long startMillis = millis(start);
        final long endMillis = millis(end);
        lock.lock();
        try {
            holdings.add(reservation, startMillis, endMillis);
        } finally {
            lock.unlock();
        }
    }

    public void removeHoldings(ReservationRef reservation) {
        lock.lock();
        try {
            holdings.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void tick(long cycle) {
        lock.lock();
        try {
            renewing.tick(cycle);
            holdings.tick(clock.cycleEndInMillis(cycle));
        } finally {
            lock.unlock();
        }
    }
}
