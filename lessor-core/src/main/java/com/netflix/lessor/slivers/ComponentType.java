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
 * Types of components attached to a compute node.
 */
public enum ComponentType {
    /**
     * An SR-IOV virtual function of a NIC shared among tenants. Each allocation consumes one PCI address.
     */
    SharedNIC,
    /**
     * A whole NIC dedicated to one tenant, exposing its own ports.
     */
    SmartNIC,
    /**
     * A network-attached storage volume; not matched against labels.
     */
    Storage,
    GPU,
    NVME,
    FPGA;

    /**
     * Whether a component of this type is bound as a whole to a single reservation.
     *
     * @return true for whole-device types
     */
    public boolean isDedicated() {
        switch (this) {
            case SmartNIC:
            case GPU:
            case NVME:
            case FPGA:
                return true;
            case SharedNIC:
            case Storage:
                return false;
            default:
                throw new IllegalStateException("Unknown component type " + this);
        }
    }
}
