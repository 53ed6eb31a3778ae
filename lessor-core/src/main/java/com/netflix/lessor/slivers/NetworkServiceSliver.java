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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A layer 2 or layer 3 network service, with its interfaces kept in insertion order.
 */
public class NetworkServiceSliver extends BaseSliver {
    private ServiceType type;
    private NetworkServiceLayer layer;
    private Gateway gateway;
    private final Map<String, InterfaceSliver> interfaces = new LinkedHashMap<>();

    public NetworkServiceSliver(String name, ServiceType type, NetworkServiceLayer layer) {
        super(name);
        this.type = type;
        this.layer = layer;
    }

    private NetworkServiceSliver(NetworkServiceSliver other) {
        super(other);
        this.type = other.type;
        this.layer = other.layer;
        this.gateway = other.gateway;
        for (InterfaceSliver ifs : other.interfaces.values())
            addInterface(ifs.copy());
    }

    @Override
    public SliverKind getKind() {
        return SliverKind.NetworkService;
    }

    @Override
    public NetworkServiceSliver copy() {
        return new NetworkServiceSliver(this);
    }

    public ServiceType getType() {
        return type;
    }

    public void setType(ServiceType type) {
        this.type = type;
    }

    public NetworkServiceLayer getLayer() {
        return layer;
    }

    public void setLayer(NetworkServiceLayer layer) {
        this.layer = layer;
    }

    public Gateway getGateway() {
        return gateway;
    }

    public void setGateway(Gateway gateway) {
        this.gateway = gateway;
    }

    public NetworkServiceSliver addInterface(InterfaceSliver ifs) {
        interfaces.put(ifs.getName(), ifs);
        return this;
    }

    public InterfaceSliver getInterface(String name) {
        return interfaces.get(name);
    }

    public List<InterfaceSliver> getInterfaces() {
        return Collections.unmodifiableList(new ArrayList<>(interfaces.values()));
    }
}
