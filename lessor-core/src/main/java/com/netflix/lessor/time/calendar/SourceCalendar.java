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
 * Calendar of one source delegation: the client reservations drawing resources from it (outlays), by real time,
 * and the requests to extend those reservations, by cycle.
 */
public class SourceCalendar extends BaseCalendar {
    private final String sourceId;
    private final ReservationHoldings outlays = new ReservationHoldings();
    private final ReservationList extending = new ReservationList();

    public SourceCalendar(ActorClock clock, String sourceId) {
        super(clock);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
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

    public void addOutlay(ReservationRef client, Date start, Date end) {
        final long startMillis = millis(start);
        final long endMillis = millis(end);
        lock.lock();
        try {
            outlays.add(client, startMillis, endMillis);
        } finally {
            lock.unlock();
        }
    }

    public void removeOutlay(ReservationRef client) {
        lock.lock();
        try {
            outlays.remove(client);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the extension requests scheduled for exactly the given cycle.
     *
     * @param cycle the cycle
     * @return extension requests at that cycle
     */
    public ReservationSet getExtending(long cycle) {
        lock.lock();
        try {
            return extending.getReservations(cycle);
        } finally {
            lock.unlock();
        }
    }

    public void addExtending(ReservationRef reservation, long cycle) {
        lock.lock();
        try {
            extending.add(reservation, cycle);
        } finally {
            lock.unlock();
        }
    }

    public void removeExtending(ReservationRef reservation) {
        lock.lock();
        try {
            extending.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(ReservationRef reservation) {
        lock.lock();
        try {
            outlays.remove(reservation);
            extending.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeScheduledOrInProgress(ReservationRef reservation) {
        removeExtending(reservation);
    }

    @Override
    public void tick(long cycle) {
        lock.lock();
        try {
            extending.tick(cycle);
            outlays.tick(clock.cycleEndInMillis(cycle));
        } finally {
            lock.unlock();
        }
    }
}
