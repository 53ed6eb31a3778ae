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
 * Calendar of an authority: incoming requests and closings grouped by cycle, and the reservations its resources
 * are currently lent to (outlays), indexed by real time.
 */
public class AuthorityCalendar extends BaseCalendar {
    private final ReservationList requests = new ReservationList();
    private final ReservationList closing = new ReservationList();
    private final ReservationHoldings outlays = new ReservationHoldings();

    public AuthorityCalendar(ActorClock clock) {
        super(clock);
    }

    @Override
    public void remove(ReservationRef reservation) {
        lock.lock();
        try {
            removeScheduledOrInProgress(reservation);
            outlays.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeScheduledOrInProgress(ReservationRef reservation) {
        lock.lock();
        try {
            requests.remove(reservation);
            closing.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getRequests(long cycle) {
        lock.lock();
        try {
            return requests.getReservations(cycle);
        } finally {
            lock.unlock();
        }
    }

    public void addRequest(ReservationRef reservation, long cycle) {
        lock.lock();
        try {
            requests.add(reservation, cycle);
        } finally {
            lock.unlock();
        }
    }

    public void removeRequest(ReservationRef reservation) {
        lock.lock();
        try {
            requests.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getClosing(long cycle) {
        lock.lock();
        try {
            return closing.getAllReservations(cycle);
        } finally {
            lock.unlock();
        }
    }

    public void addClosing(ReservationRef reservation, long cycle) {
        lock.lock();
        try {
            closing.add(reservation, cycle);
        } finally {
            lock.unlock();
        }
    }

    public void removeClosing(ReservationRef reservation) {
        lock.lock();
        try {
            closing.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getOutlays() {
        lock.lock();
        try {
            return outlays.getReservations();
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getOutlays(Date when) {
        final long time = millis(when);
        lock.lock();
        try {
            return outlays.getReservations(time);
        } finally {
            lock.unlock();
        }
    }

    public void addOutlay(ReservationRef reservation, Date start, Date end) {
        final long startMillis = millis(start);
        final long endMillis = millis(end);
        lock.lock();
        try {
            outlays.add(reservation, startMillis, endMillis);
        } finally {
            lock.unlock();
        }
    }

    public void removeOutlay(ReservationRef reservation) {
        lock.lock();
        try {
            outlays.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void tick(long cycle) {
        lock.lock();
        try {
            requests.tick(cycle);
            closing.tick(cycle);
            outlays.tick(clock.cycleEndInMillis(cycle));
        } finally {
            lock.unlock();
        }
    }
}
