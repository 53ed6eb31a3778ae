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

/**
 * The gateway of a layer 3 network service: the subnet assigned to the service and the gateway address within
 * it, held as labels.
 */
public class Gateway {
    private final Labels labels;

    public Gateway(Labels labels) {
        this.labels = labels == null ? Labels.EMPTY : labels;
    }

    public Labels getLabels() {
        return labels;
    }

    /**
     * Get the assigned subnet in CIDR notation, IPv4 if present, otherwise IPv6.
     *
     * @return the subnet, or null
     */
    public String getSubnet() {
        return labels.getIpv4Subnet() != null ? labels.getIpv4Subnet() : labels.getIpv6Subnet();
    }

    /**
     * Get the gateway address, IPv4 if present, otherwise IPv6.
     *
     * @return the gateway address, or null
     */
    public String getGateway() {
        return labels.getIpv4() != null ? labels.getIpv4() : labels.getIpv6();
    }

    @Override
    public String toString() {
        return "Gateway{subnet=" + getSubnet() + ", gateway=" + getGateway() + '}';
    }
}
