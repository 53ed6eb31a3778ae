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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * Calendar of a broker. Builds on the client calendar, where the holdings are the source delegations the broker
 * received, and adds:
 * <UL>
 *     <LI>closing: reservations grouped by the cycle on which they must be closed</LI>
 *     <LI>requests: incoming client requests grouped by start cycle</LI>
 *     <LI>a {@link SourceCalendar} per source delegation, keyed by delegation id</LI>
 * </UL>
 * Source calendars are created on first use. The broker lock is always taken before a source calendar's lock.
 */
public class BrokerCalendar extends ClientCalendar {
    private static final Logger logger = LoggerFactory.getLogger(BrokerCalendar.class);
    private final ReservationList closing = new ReservationList();
    private final ReservationList requests = new ReservationList();
    private final Map<String, SourceCalendar> sources = new HashMap<>();

    public BrokerCalendar(ActorClock clock) {
        super(clock);
    }

    @Override
    public void remove(ReservationRef reservation) {
        lock.lock();
        try {
            super.remove(reservation);
            closing.remove(reservation);
            requests.remove(reservation);
            for (SourceCalendar calendar : sources.values())
                calendar.remove(reservation);
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
            requests.remove(reservation);
            for (SourceCalendar calendar : sources.values())
                calendar.removeScheduledOrInProgress(reservation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the client requests starting at exactly the given cycle.
     *
     * @param cycle the cycle
     * @return requests starting at that cycle
     */
    public ReservationSet getRequests(long cycle) {
        lock.lock();
        try {
            return requests.getReservations(cycle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the client requests starting no later than the given cycle.
     *
     * @param cycle the cycle
     * @return requests starting up to and including that cycle
     */
    public ReservationSet getAllRequests(long cycle) {
        lock.lock();
        try {
            return requests.getAllReservations(cycle);
        } finally {
            lock.unlock();
        }
    }

    public void addRequest(ReservationRef reservation, long cycle) {
        addRequest(reservation, cycle, null);
    }

    /**
     * Add a client request. A request with a source is an extension of a reservation satisfied from that source
     * and is kept in the source's calendar.
     *
     * @param reservation the client request
     * @param cycle start cycle
     * @param sourceId delegation id of the source, or null for a new request
     */
    public void addRequest(ReservationRef reservation, long cycle, String sourceId) {
        lock.lock();
        try {
            if (sourceId == null)
                requests.add(reservation, cycle);
            else
                getSourceCalendar(sourceId).addExtending(reservation, cycle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the extension requests for the given source at the given cycle.
     *
     * @param sourceId delegation id of the source
     * @param cycle the cycle
     * @return extension requests for that source starting at that cycle
     */
    public ReservationSet getRequest(String sourceId, long cycle) {
        lock.lock();
        try {
            return getSourceCalendar(sourceId).getExtending(cycle);
        } finally {
            lock.unlock();
        }
    }

    public void removeRequest(ReservationRef reservation) {
        removeRequest(reservation, null);
    }

    public void removeRequest(ReservationRef reservation, String sourceId) {
        lock.lock();
        try {
            if (sourceId == null)
                requests.remove(reservation);
            else {
                final SourceCalendar calendar = sources.get(sourceId);
                if (calendar != null)
                    calendar.removeExtending(reservation);
            }
        } finally {
            lock.unlock();
        }
    }

    public void addOutlay(String sourceId, ReservationRef client, Date start, Date end) {
        lock.lock();
        try {
            getSourceCalendar(sourceId).addOutlay(client, start, end);
        } finally {
            lock.unlock();
        }
    }

    public void removeOutlay(String sourceId, ReservationRef client) {
        lock.lock();
        try {
            final SourceCalendar calendar = sources.get(sourceId);
            if (calendar != null)
                calendar.removeOutlay(client);
        } finally {
            lock.unlock();
        }
    }

    public ReservationSet getOutlays(String sourceId) {
        lock.lock();
        try {
            return getSourceCalendar(sourceId).getOutlays();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the client reservations satisfied from the given source at the given time.
     *
     * @param sourceId delegation id of the source
     * @param when the time instant
     * @return client reservations drawing from that source at that time
     */
    public ReservationSet getOutlays(String sourceId, Date when) {
        lock.lock();
        try {
            return getSourceCalendar(sourceId).getOutlays(when);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Register a source delegation: creates its calendar if needed and adds the source reservation to the
     * holdings for its term.
     *
     * @param sourceId delegation id of the source
     * @param source the reservation that carries the delegation
     * @param start start of the source term
     * @param end end of the source term
     */
    public void addSource(String sourceId, ReservationRef source, Date start, Date end) {
        lock.lock();
        try {
            getSourceCalendar(sourceId);
            addHoldings(source, start, end);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the calendar of a source delegation, creating it on first use.
     *
     * @param sourceId delegation id of the source
     * @return the source calendar
     */
    public SourceCalendar getSourceCalendar(String sourceId) {
        if (sourceId == null)
            throw new IllegalArgumentException("sourceId must not be null");
        lock.lock();
        try {
            SourceCalendar calendar = sources.get(sourceId);
            if (calendar == null) {
                calendar = new SourceCalendar(clock, sourceId);
                sources.put(sourceId, calendar);
                logger.debug("Created source calendar for delegation " + sourceId);
            }
            return calendar;
        } finally {
            lock.unlock();
        }
    }

    public void removeSourceCalendar(String sourceId) {
        lock.lock();
        try {
            sources.remove(sourceId);
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

    @Override
    public void tick(long cycle) {
        lock.lock();
        try {
            super.tick(cycle);
            requests.tick(cycle);
            closing.tick(cycle);
            for (SourceCalendar calendar : sources.values())
                calendar.tick(cycle);
        } finally {
            lock.unlock();
        }
    }
}
