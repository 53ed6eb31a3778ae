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

import java.util.Comparator;

/**
 * A reservation together with its validity interval, closed on both sides.
 */
class ReservationWrapper {

    /**
     * Orders by end time, then by reservation identifier. A wrapper without a reservation sorts before every
     * wrapper with the same end time, which makes it a search key for the first entry ending at a given time.
     */
    static final Comparator<ReservationWrapper> BY_END = (o1, o2) -> {
        final int c = Long.compare(o1.end, o2.end);
        if (c != 0)
            return c;
        if (o1.reservation == null)
            return o2.reservation == null ? 0 : -1;
        if (o2.reservation == null)
            return 1;
        return o1.reservation.getReservationId().compareTo(o2.reservation.getReservationId());
    };

    private final ReservationRef reservation;
    private final long start;
    private final long end;

    ReservationWrapper(ReservationRef reservation, long start, long end) {
        this.reservation = reservation;
        this.start = start;
        this.end = end;
    }

    static ReservationWrapper key(long time) {
        return new ReservationWrapper(null, time, time);
    }

    ReservationRef getReservation() {
        return reservation;
    }

    long getStart() {
        return start;
    }

    long getEnd() {
        return end;
    }

    boolean contains(long time) {
        return start <= time && time <= end;
    }

    @Override
    public String toString() {
        return (reservation == null ? "key" : reservation.getReservationId()) + ":[" + start + ", " + end + "]";
    }
}
