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

import java.util.Date;

/**
 * Conversions between the notions of time used by an actor: milliseconds, dates, and cycles. Each container can
 * have its own beginning of time and cycle length without affecting the correctness of the program.
 * <P>
 * Leases start on the first millisecond of the start time of the term and continue until the last millisecond of
 * the end time of the term, so lease intervals are closed on both sides.
 */
public class ActorClock {
    private final long beginningOfTime;
    private final long cycleMillis;

    /**
     * Create a clock.
     *
     * @param beginningOfTime time offset of cycle 0, in milliseconds since the epoch
     * @param cycleMillis length of a cycle, in milliseconds
     * @throws IllegalArgumentException if the offset is negative or the cycle length is less than 1
     */
    public ActorClock(long beginningOfTime, long cycleMillis) {
        if (beginningOfTime < 0 || cycleMillis < 1)
            throw new IllegalArgumentException("Invalid clock arguments: beginningOfTime=" + beginningOfTime +
                    ", cycleMillis=" + cycleMillis);
        this.beginningOfTime = beginningOfTime;
        this.cycleMillis = cycleMillis;
    }

    public long getBeginningOfTime() {
        return beginningOfTime;
    }

    public long getCycleMillis() {
        return cycleMillis;
    }

    public static long toMillis(Date when) {
        if (when == null)
            throw new IllegalArgumentException("date must not be null");
        return when.getTime();
    }

    public static Date fromMillis(long millis) {
        return new Date(millis);
    }

    public static long getCurrentMillis() {
        return System.currentTimeMillis();
    }

    /**
     * Get the cycle a date falls into. Dates before the beginning of time are in cycle 0.
     *
     * @param when the date
     * @return the cycle
     */
    public long cycle(Date when) {
        return cycle(toMillis(when));
    }

    public long cycle(long millis) {
        if (millis < beginningOfTime)
            return 0;
        return (millis - beginningOfTime) / cycleMillis;
    }

    /**
     * Get the number of whole cycles a span of milliseconds represents.
     *
     * @param millis the span length
     * @return the number of cycles
     */
    public long convertMillis(long millis) {
        if (millis < 0)
            throw new IllegalArgumentException("Negative milliseconds: " + millis);
        return millis / cycleMillis;
    }

    /**
     * Get the length in milliseconds of a span of cycles. Does not look at the beginning of time.
     *
     * @param cycles the number of cycles
     * @return the span length in milliseconds
     */
    public long getMillis(long cycles) {
        if (cycles < 0)
            throw new IllegalArgumentException("Negative cycle count: " + cycles);
        return cycles * cycleMillis;
    }

    public long cycleStartInMillis(long cycle) {
        return beginningOfTime + cycle * cycleMillis;
    }

    public long cycleEndInMillis(long cycle) {
        return cycleStartInMillis(cycle) + cycleMillis - 1;
    }

    public Date date(long cycle) {
        checkCycle(cycle);
        return fromMillis(cycleStartInMillis(cycle));
    }

    public Date cycleStartDate(long cycle) {
        return date(cycle);
    }

    public Date cycleEndDate(long cycle) {
        checkCycle(cycle);
        return fromMillis(cycleEndInMillis(cycle));
    }

    private static void checkCycle(long cycle) {
        if (cycle < 0)
            throw new IllegalArgumentException("Negative cycle: " + cycle);
    }

    @Override
    public String toString() {
        return "ActorClock{beginningOfTime=" + beginningOfTime + ", cycleMillis=" + cycleMillis + '}';
    }
}
