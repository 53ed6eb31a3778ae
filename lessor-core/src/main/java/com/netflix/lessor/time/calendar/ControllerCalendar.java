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
import com.netflix.lessor.time.ReservationList;

/**
 * Calendar of a controller. Adds to the client lists the reservations grouped by the cycle on which they must be
 * closed and those grouped by the cycle on which their tickets must be redeemed.
 */
public class ControllerCalendar extends ClientCalendar {
    private final ReservationList closing = new ReservationList();
    private final ReservationList redeeming = new ReservationList();

    public ControllerCalendar(ActorClock clock) {
        super(clock);
    }

    @Override
    public void remove(ReservationRef reservation) {
        lock.lock();
        try {
            super.remove(reservation);
            closing.remove(reservation);
            redeeming.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeScheduledOrInProgress(ReservationRef reservation) {
        lock.lock();
        try {
            super.removeScheduledOrInProgress(reservation);
            closing.remove(reservation);
            redeeming.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the reservations that must be closed by the given cycle.
     *
     * @param cycle the cycle
     * @return reservations to close up to and including that cycle
     */
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

    /**
     * Get the reservations whose tickets must be redeemed by the given cycle.
     *
     * @param cycle the cycle
     * @return reservations to redeem up to and including that cycle
     */
    public ReservationSet getRedeeming(long cycle) {
        lock.lock();
        try {
            return redeeming.getAllReservations(cycle);
        } finally {
            lock.unlock();
        }
    }

    public void addRedeeming(ReservationRef reservation, long cycle) {
        lock.lock();
        try {
            redeeming.add(reservation, cycle);
        } finally {
            lock.unlock();
        }
    }

    public void removeRedeeming(ReservationRef reservation) {
        lock.lock();
        try {
            redeeming.remove(reservation);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void tick(long cycle) {
        lock.lock();
        try {
            super.tick(cycle);
            closing.tick(cycle);
            redeeming.tick(cycle);
        } finally {
            lock.unlock();
        }
    }
}
