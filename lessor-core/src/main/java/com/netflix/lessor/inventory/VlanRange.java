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

package com.netflix.lessor.inventory;

import java.util.Set;

/**
 * A range of VLAN tags, both ends included.
 */
class VlanRange {
    private final int low;
    private final int high;

    private VlanRange(int low, int high) {
        this.low = low;
        this.high = high;
    }

    /**
     * Parse a range of the form {@code low-high}.
     *
     * @throws IllegalArgumentException if the text is not a valid range
     */
    static VlanRange parse(String text) {
        if (text == null)
            throw new IllegalArgumentException("VLAN range must not be null");
        final String[] parts = text.split("-");
        if (parts.length != 2)
            throw new IllegalArgumentException("Invalid VLAN range " + text);
        final int low;
        final int high;
        try {
            low = Integer.parseInt(parts[0].trim());
            high = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid VLAN range " + text, e);
        }
        if (low > high)
            throw new IllegalArgumentException("Invalid VLAN range " + text);
        return new VlanRange(low, high);
    }

    boolean contains(int vlan) {
        return low <= vlan && vlan <= high;
    }

    Integer firstFree(Set<Integer> used) {
        for (int vlan = low; vlan <= high; vlan++) {
            if (!used.contains(vlan))
                return vlan;
        }
        return null;
    }

    @Override
    public String toString() {
        return low + "-" + high;
    }
}
