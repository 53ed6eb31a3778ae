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

import com.netflix.lessor.ReservationProvider;
import com.netflix.lessor.ReservationRef;
import com.netflix.lessor.ReservationSet;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ReservationHoldingsTest {

    private ReservationHoldings holdings;

    @Before
    public void setUp() throws Exception {
        holdings = new ReservationHoldings();
    }

    @Test
    public void testQueryIsClosedOnBothEnds() throws Exception {
        ReservationRef r = ReservationProvider.getReservation("r1");
        holdings.add(r, 10, 20);
        assertThat(holdings.getReservations(9).size(), is(0));
        assertThat(holdings.getReservations(10).contains(r), is(true));
        assertThat(holdings.getReservations(20).contains(r), is(true));
        assertThat(holdings.getReservations(21).size(), is(0));
    }

    @Test
    public void testQueryFindsLongIntervalsAfterShortOnes() throws Exception {
        ReservationRef early = ReservationProvider.getReservation("a");
        ReservationRef late = ReservationProvider.getReservation("b");
        ReservationRef future = ReservationProvider.getReservation("c");
        holdings.add(early, 0, 15);
        holdings.add(late, 5, 100);
        holdings.add(future, 50, 60);
        ReservationSet at10 = holdings.getReservations(10);
        assertThat(at10.size(), is(2));
        assertThat(at10.contains(early), is(true));
        assertThat(at10.contains(late), is(true));
    }

    @Test
    public void testQueryByType() throws Exception {
        holdings.add(ReservationProvider.getReservation("vm1", "vm"), 0, 10);
        holdings.add(ReservationProvider.getReservation("net1", "network"), 0, 10);
        ReservationSet vms = holdings.getReservations(5, "vm");
        assertThat(vms.size(), is(1));
        assertThat(vms.contains("vm1"), is(true));
        assertThat(holdings.getReservations(5).size(), is(2));
    }

    @Test
    public void testTickRemovesEndedIntervals() throws Exception {
        ReservationRef first = ReservationProvider.getReservation("r1");
        ReservationRef second = ReservationProvider.getReservation("r2");
        holdings.add(first, 1000, 1005);
        holdings.add(second, 995, 1000);
        holdings.tick(1000);
        assertThat(holdings.size(), is(1));
        assertThat(holdings.getReservations().contains(first), is(true));
        assertThat(holdings.getReservations().contains(second), is(false));
        assertThat(holdings.getReservations(1000).contains(first), is(true));
    }

    @Test
    public void testExtensionKeepsOriginalStart() throws Exception {
        ReservationRef r = ReservationProvider.getReservation("r1");
        holdings.add(r, 995, 1000);
        holdings.add(r, 1001, 1005);
        assertThat(holdings.size(), is(1));
        assertThat(holdings.getReservations(995).contains(r), is(true));
        assertThat(holdings.getReservations(1005).contains(r), is(true));
        holdings.tick(1000);
        assertThat(holdings.size(), is(1));
        holdings.tick(1005);
        assertThat(holdings.size(), is(0));
    }

    @Test(expected = IllegalStateException.class)
    public void testExtensionWithGapFails() throws Exception {
        ReservationRef r = ReservationProvider.getReservation("r1");
        holdings.add(r, 995, 1000);
        holdings.add(r, 1002, 1010);
    }

    @Test
    public void testRemove() throws Exception {
        ReservationRef r1 = ReservationProvider.getReservation("r1");
        ReservationRef r2 = ReservationProvider.getReservation("r2");
        holdings.add(r1, 0, 10);
        holdings.add(r2, 0, 10);
        holdings.remove(r1);
        holdings.remove(ReservationProvider.getReservation("absent"));
        assertThat(holdings.size(), is(1));
        assertThat(holdings.getReservations(5).contains(r2), is(true));
        assertThat(holdings.getReservations(5).contains(r1), is(false));
    }

    @Test
    public void testQueriesMatchBruteForce() throws Exception {
        final Random random = new Random(42);
        final List<long[]> intervals = new ArrayList<>();
        final List<ReservationRef> reservations = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            long start = random.nextInt(1000);
            long end = start + random.nextInt(200);
            ReservationRef r = ReservationProvider.getReservation("r" + i);
            holdings.add(r, start, end);
            intervals.add(new long[]{start, end});
            reservations.add(r);
        }
        final long ticked = 300;
        holdings.tick(ticked);
        for (long t = 0; t < 1300; t += 7) {
            ReservationSet result = holdings.getReservations(t);
            int expected = 0;
            for (int i = 0; i < intervals.size(); i++) {
                long[] interval = intervals.get(i);
                boolean present = interval[1] > ticked;
                boolean inside = interval[0] <= t && t <= interval[1];
                assertThat(result.contains(reservations.get(i)), is(present && inside));
                if (present && inside)
                    expected++;
            }
            assertThat(result.size(), is(expected));
        }
        assertThat(holdings.size(), is(holdings.getReservations().size()));
    }
}
