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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable set of labels. Delegated label pools carry several values per field (for example every PCI
 * address of a shared NIC, with the MAC address and VLAN at the same index), while an allocation carries a single
 * value per field. Both use this type: list-valued fields are exposed as lists, and the singular accessors return
 * the first value.
 */
@JsonIgnoreProperties(ignoreUnknown=true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Labels {

    public static final Labels EMPTY = new Builder().build();

    private final List<String> bdf;
    private final List<String> mac;
    private final List<String> vlan;
    private final List<String> numa;
    private final List<String> localName;
    private final String vlanRange;
    private final String ipv4;
    private final String ipv6;
    private final String ipv4Subnet;
    private final String ipv6Subnet;
    private final String instanceParent;

    @JsonCreator
    public Labels(@JsonProperty("bdf") List<String> bdf,
                  @JsonProperty("mac") List<String> mac,
                  @JsonProperty("vlan") List<String> vlan,
                  @JsonProperty("numa") List<String> numa,
                  @JsonProperty("local_name") List<String> localName,
                  @JsonProperty("vlan_range") String vlanRange,
                  @JsonProperty("ipv4") String ipv4,
                  @JsonProperty("ipv6") String ipv6,
                  @JsonProperty("ipv4_subnet") String ipv4Subnet,
                  @JsonProperty("ipv6_subnet") String ipv6Subnet,
                  @JsonProperty("instance_parent") String instanceParent) {
        this.bdf = immutable(bdf);
        this.mac = immutable(mac);
        this.vlan = immutable(vlan);
        this.numa = immutable(numa);
        this.localName = immutable(localName);
        this.vlanRange = vlanRange;
        this.ipv4 = ipv4;
        this.ipv6 = ipv6;
        this.ipv4Subnet = ipv4Subnet;
        this.ipv6Subnet = ipv6Subnet;
        this.instanceParent = instanceParent;
    }

    private static List<String> immutable(List<String> values) {
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    private static String first(List<String> values) {
        return values.isEmpty() ? null : values.get(0);
    }

    @JsonProperty("bdf")
    public List<String> getBdfs() {
        return bdf;
    }

    @JsonIgnore
    public String getBdf() {
        return first(bdf);
    }

    @JsonProperty("mac")
    public List<String> getMacs() {
        return mac;
    }

    @JsonIgnore
    public String getMac() {
        return first(mac);
    }

    @JsonProperty("vlan")
    public List<String> getVlans() {
        return vlan;
    }

    @JsonIgnore
    public String getVlan() {
        return first(vlan);
    }

    @JsonProperty("numa")
    public List<String> getNumas() {
        return numa;
    }

    @JsonIgnore
    public String getNuma() {
        return first(numa);
    }

    @JsonProperty("local_name")
    public List<String> getLocalNames() {
        return localName;
    }

    @JsonIgnore
    public String getLocalName() {
        return first(localName);
    }

    @JsonProperty("vlan_range")
    public String getVlanRange() {
        return vlanRange;
    }

    @JsonProperty("ipv4")
    public String getIpv4() {
        return ipv4;
    }

    @JsonProperty("ipv6")
    public String getIpv6() {
        return ipv6;
    }

    @JsonProperty("ipv4_subnet")
    public String getIpv4Subnet() {
        return ipv4Subnet;
    }

    @JsonProperty("ipv6_subnet")
    public String getIpv6Subnet() {
        return ipv6Subnet;
    }

    @JsonProperty("instance_parent")
    public String getInstanceParent() {
        return instanceParent;
    }

    /**
     * Create a builder initialized with the labels of this instance.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder()
                .withBdfs(bdf)
                .withMacs(mac)
                .withVlans(vlan)
                .withNumas(numa)
                .withLocalNames(localName)
                .withVlanRange(vlanRange)
                .withIpv4(ipv4)
                .withIpv6(ipv6)
                .withIpv4Subnet(ipv4Subnet)
                .withIpv6Subnet(ipv6Subnet)
                .withInstanceParent(instanceParent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Labels labels = (Labels) o;
        return bdf.equals(labels.bdf) && mac.equals(labels.mac) && vlan.equals(labels.vlan) &&
                numa.equals(labels.numa) && localName.equals(labels.localName) &&
                Objects.equals(vlanRange, labels.vlanRange) && Objects.equals(ipv4, labels.ipv4) &&
                Objects.equals(ipv6, labels.ipv6) && Objects.equals(ipv4Subnet, labels.ipv4Subnet) &&
                Objects.equals(ipv6Subnet, labels.ipv6Subnet) && Objects.equals(instanceParent, labels.instanceParent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bdf, mac, vlan, numa, localName, vlanRange, ipv4, ipv6, ipv4Subnet, ipv6Subnet,
                instanceParent);
    }

    @Override
    public String toString() {
        return "Labels{" +
                "bdf=" + bdf +
                ", mac=" + mac +
                ", vlan=" + vlan +
                ", numa=" + numa +
                ", localName=" + localName +
                ", vlanRange=" + vlanRange +
                ", ipv4=" + ipv4 +
                ", ipv6=" + ipv6 +
                ", ipv4Subnet=" + ipv4Subnet +
                ", ipv6Subnet=" + ipv6Subnet +
                ", instanceParent=" + instanceParent +
                '}';
    }

    /**
     * Builder class for {@link Labels}.
     */
    public static class Builder {
        private List<String> bdf;
        private List<String> mac;
        private List<String> vlan;
        private List<String> numa;
        private List<String> localName;
        private String vlanRange;
        private String ipv4;
        private String ipv6;
        private String ipv4Subnet;
        private String ipv6Subnet;
        private String instanceParent;

        private static List<String> single(String value) {
            return value == null ? null : Collections.singletonList(value);
        }

        public Builder withBdf(String bdf) {
            this.bdf = single(bdf);
            return this;
        }

        public Builder withBdfs(List<String> bdf) {
            this.bdf = bdf;
            return this;
        }

        public Builder withMac(String mac) {
            this.mac = single(mac);
            return this;
        }

        public Builder withMacs(List<String> mac) {
            this.mac = mac;
            return this;
        }

        public Builder withVlan(String vlan) {
            this.vlan = single(vlan);
            return this;
        }

        public Builder withVlans(List<String> vlan) {
            this.vlan = vlan;
            return this;
        }

        public Builder withNuma(String numa) {
            this.numa = single(numa);
            return this;
        }

        public Builder withNumas(List<String> numa) {
            this.numa = numa;
            return this;
        }

        public Builder withLocalName(String localName) {
            this.localName = single(localName);
            return this;
        }

        public Builder withLocalNames(List<String> localName) {
            this.localName = localName;
            return this;
        }

        public Builder withVlanRange(String vlanRange) {
            this.vlanRange = vlanRange;
            return this;
        }

        public Builder withIpv4(String ipv4) {
            this.ipv4 = ipv4;
            return this;
        }

        public Builder withIpv6(String ipv6) {
            this.ipv6 = ipv6;
            return this;
        }

        public Builder withIpv4Subnet(String ipv4Subnet) {
            this.ipv4Subnet = ipv4Subnet;
            return this;
        }

        public Builder withIpv6Subnet(String ipv6Subnet) {
            this.ipv6Subnet = ipv6Subnet;
            return this;
        }

        public Builder withInstanceParent(String instanceParent) {
            this.instanceParent = instanceParent;
            return this;
        }

        public Labels build() {
            return new Labels(bdf, mac, vlan, numa, localName, vlanRange, ipv4, ipv6, ipv4Subnet, ipv6Subnet,
                    instanceParent);
        }
    }
}
