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

package com.netflix.lessor.slivers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable vector of quantifiable resources. The same type describes a delegated pool, a request, and an
 * allocation. Arithmetic returns new instances, so a pool inspected by several candidate-selection attempts is
 * never changed underneath them.
 * <P>
 * A pool is exhausted when subtracting allocations from it leaves a negative field; see {@link #negativeFields()}.
 */
@JsonIgnoreProperties(ignoreUnknown=true)
public class Capacities {

    public static final Capacities EMPTY = new Builder().build();

    private final int core;
    private final int cpu;
    private final int ram;
    private final int disk;
    private final int bw;
    private final int burstSize;
    private final int unit;
    private final int mtu;

    @JsonCreator
    public Capacities(@JsonProperty("core") int core,
                      @JsonProperty("cpu") int cpu,
                      @JsonProperty("ram") int ram,
                      @JsonProperty("disk") int disk,
                      @JsonProperty("bw") int bw,
                      @JsonProperty("burst_size") int burstSize,
                      @JsonProperty("unit") int unit,
                      @JsonProperty("mtu") int mtu) {
        this.core = core;
        this.cpu = cpu;
        this.ram = ram;
        this.disk = disk;
        this.bw = bw;
        this.burstSize = burstSize;
        this.unit = unit;
        this.mtu = mtu;
    }

    public static Capacities ofUnits(int unit) {
        return new Builder().withUnit(unit).build();
    }

    @JsonProperty("core")
    public int getCore() {
        return core;
    }

    @JsonProperty("cpu")
    public int getCpu() {
        return cpu;
    }

    @JsonProperty("ram")
    public int getRam() {
        return ram;
    }

    @JsonProperty("disk")
    public int getDisk() {
        return disk;
    }

    @JsonProperty("bw")
    public int getBw() {
        return bw;
    }

    @JsonProperty("burst_size")
    public int getBurstSize() {
        return burstSize;
    }

    @JsonProperty("unit")
    public int getUnit() {
        return unit;
    }

    @JsonProperty("mtu")
    public int getMtu() {
        return mtu;
    }

    public Capacities plus(Capacities other) {
        return new Capacities(core + other.core, cpu + other.cpu, ram + other.ram, disk + other.disk,
                bw + other.bw, burstSize + other.burstSize, unit + other.unit, mtu + other.mtu);
    }

    public Capacities minus(Capacities other) {
        return new Capacities(core - other.core, cpu - other.cpu, ram - other.ram, disk - other.disk,
                bw - other.bw, burstSize - other.burstSize, unit - other.unit, mtu - other.mtu);
    }

    /**
     * Get the names of the fields that are negative, in declaration order.
     *
     * @return names of negative fields, empty if none is negative
     */
    public List<String> negativeFields() {
        List<String> result = new ArrayList<>();
        if (core < 0)
            result.add("core");
        if (cpu < 0)
            result.add("cpu");
        if (ram < 0)
            result.add("ram");
        if (disk < 0)
            result.add("disk");
        if (bw < 0)
            result.add("bw");
        if (burstSize < 0)
            result.add("burst_size");
        if (unit < 0)
            result.add("unit");
        if (mtu < 0)
            result.add("mtu");
        return result;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return equals(EMPTY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Capacities that = (Capacities) o;
        return core == that.core && cpu == that.cpu && ram == that.ram && disk == that.disk && bw == that.bw &&
                burstSize == that.burstSize && unit == that.unit && mtu == that.mtu;
    }

    @Override
    public int hashCode() {
        return Objects.hash(core, cpu, ram, disk, bw, burstSize, unit, mtu);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        append(sb, "core", core);
        append(sb, "cpu", cpu);
        append(sb, "ram", ram);
        append(sb, "disk", disk);
        append(sb, "bw", bw);
        append(sb, "burst_size", burstSize);
        append(sb, "unit", unit);
        append(sb, "mtu", mtu);
        return sb.append("}").toString();
    }

    private static void append(StringBuilder sb, String name, int value) {
        if (value == 0)
            return;
        if (sb.length() > 1)
            sb.append(", ");
        sb.append(name).append(": ").append(value);
    }

    /**
     * Builder class for {@link Capacities}. All fields default to 0.
     */
    public static class Builder {
        private int core;
        private int cpu;
        private int ram;
        private int disk;
        private int bw;
        private int burstSize;
        private int unit;
        private int mtu;

        public Builder withCore(int core) {
            this.core = core;
            return this;
        }

        public Builder withCpu(int cpu) {
            this.cpu = cpu;
            return this;
        }

        public Builder withRam(int ram) {
            this.ram = ram;
            return this;
        }

        public Builder withDisk(int disk) {
            this.disk = disk;
            return this;
        }

        public Builder withBw(int bw) {
            this.bw = bw;
            return this;
        }

        public Builder withBurstSize(int burstSize) {
            this.burstSize = burstSize;
            return this;
        }

        public Builder withUnit(int unit) {
            this.unit = unit;
            return this;
        }

        public Builder withMtu(int mtu) {
            this.mtu = mtu;
            return this;
        }

        public Capacities build() {
            return new Capacities(core, cpu, ram, disk, bw, burstSize, unit, mtu);
        }
    }
}
