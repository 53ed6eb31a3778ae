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

public enum ServiceType {
    FABNetv4,
    FABNetv6,
    L2Bridge,
    L2STS,
    L2PTP,
    MPLS,
    P4,
    PortMirror;

    /**
     * Whether this service type is a routed service that receives a subnet and a gateway.
     *
     * @return true for FABNetv4 and FABNetv6
     */
    public boolean isRouted() {
        return this == FABNetv4 || this == FABNetv6;
    }
}
