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
import com.netflix.lessor.time.ActorClock;

import java.util.Date;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Base class for the calendars that organize reservations of an actor by time. Every public operation of a
 * calendar runs under the calendar's lock, and every getter returns a copy that callers may iterate without
 * holding the lock.
 */
public abstract class BaseCalendar {
    protected final ActorClock clock;
    protected final ReentrantLock lock = new ReentrantLock();

    protected BaseCalendar(ActorClock clock) {
        if (clock == null)
            throw new IllegalArgumentException("clock must not be null");
        this.clock = clock;
    }

    public ActorClock getClock() {
        return clock;
    }

    /**
     * Remove the reservation from every list of this calendar. Lists that do not hold it are left alone.
     *
     * @param reservation the reservation to remove
     */
    public abstract void remove(ReservationRef reservation);

    /**
     * Remove the reservation from the lists that represent operations scheduled for the future or currently in
     * progress. Lists of resources held are left alone.
     *
     * @param reservation the reservation to remove
     */
    public abstract void removeScheduledOrInProgress(ReservationRef reservation);

    /**
     * Advance the calendar to the given cycle, reclaiming everything that can no longer be acted upon.
     *
     * @param cycle the current cycle
     */
    public abstract void tick(long cycle);

    protected static long millis(Date when) {
        return ActorClock.toMillis(when);
    }
}
