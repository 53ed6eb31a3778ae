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
 * A component attached to a compute node. NIC components expose their ports as nested network services.
 */
public class ComponentSliver extends BaseSliver {
    private ComponentType type;
    private String model;
    private final Map<String, NetworkServiceSliver> networkServices = new LinkedHashMap<>();

    public ComponentSliver(String name, ComponentType type, String model) {
        super(name);
        this.type = type;
        this.model = model;
    }

    private ComponentSliver(ComponentSliver other) {
        super(other);
        this.type = other.type;
        this.model = other.model;
        for (NetworkServiceSliver ns : other.networkServices.values())
            addNetworkService(ns.copy());
    }

    @Override
    public SliverKind getKind() {
        return SliverKind.Component;
    }

    @Override
    public ComponentSliver copy() {
        return new ComponentSliver(this);
    }

    public ComponentType getType() {
        return type;
    }

    public void setType(ComponentType type) {
        this.type = type;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public ComponentSliver addNetworkService(NetworkServiceSliver ns) {
        networkServices.put(ns.getName(), ns);
        return this;
    }

    public List<NetworkServiceSliver> getNetworkServices() {
        return Collections.unmodifiableList(new ArrayList<>(networkServices.values()));
    }
}
