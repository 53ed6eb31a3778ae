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

import com.netflix.lessor.ReservationProvider;
import com.netflix.lessor.ReservationRef;
import com.netflix.lessor.time.ActorClock;
import org.junit.Test;

import java.util.Date;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ControllerCalendarTest {

    private final ControllerCalendar calendar = new ControllerCalendar(new ActorClock(0, 10));

    @Test
    public void testClosingAndRedeemingReclaimedOnTick() throws Exception {
        ReservationRef closing = ReservationProvider.getReservation("closing");
        ReservationRef redeeming = ReservationProvider.getReservation("redeeming");
        ReservationRef later = ReservationProvider.getReservation("later");
        calendar.addClosing(closing, 3);
        calendar.addRedeeming(redeeming, 2);
        calendar.addRedeeming(later, 8);
        assertThat(calendar.getClosing(3).contains(closing), is(true));
        assertThat(calendar.getRedeeming(5).size(), is(1));

        calendar.tick(5);
        assertThat(calendar.getClosing(10).isEmpty(), is(true));
        assertThat(calendar.getRedeeming(10).contains(later), is(true));
        assertThat(calendar.getRedeeming(10).size(), is(1));
    }

    @Test
    public void testRemoveIncludesClientLists() throws Exception {
        ReservationRef r = ReservationProvider.getReservation("r1");
        calendar.addClosing(r, 3);
        calendar.addRedeeming(r, 1);
        calendar.addPending(r);
        calendar.addHoldings(r, new Date(0), new Date(100));
        calendar.remove(r);
        assertThat(calendar.getClosing(10).isEmpty(), is(true));
        assertThat(calendar.getRedeeming(10).isEmpty(), is(true));
        assertThat(calendar.getPending().isEmpty(), is(true));
        assertThat(calendar.getHoldings().isEmpty(), is(true));
    }

    @Test
    public void testRemoveScheduledKeepsHoldings() throws Exception {
        ReservationRef r = ReservationProvider.getReservation("r1");
        calendar.addClosing(r, 3);
        calendar.addHoldings(r, new Date(0), new Date(100));
        calendar.removeScheduledOrInProgress(r);
        assertThat(calendar.getClosing(10).isEmpty(), is(true));
        assertThat(calendar.getHoldings().contains(r), is(true));
    }
}
