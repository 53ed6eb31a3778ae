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
 * A compute node, switch, or facility. Attached components and owned network services are kept in insertion
 * order, which is the order in which allocators consider them.
 */
public class NodeSliver extends BaseSliver {
    private NodeType type;
    private String site;
    private String managementIp;
    private final Map<String, ComponentSliver> components = new LinkedHashMap<>();
    private final Map<String, NetworkServiceSliver> networkServices = new LinkedHashMap<>();

    public NodeSliver(String name, NodeType type) {
        super(name);
        this.type = type;
    }

    private NodeSliver(NodeSliver other) {
        super(other);
        this.type = other.type;
        this.site = other.site;
        this.managementIp = other.managementIp;
        for (ComponentSliver c : other.components.values())
            addComponent(c.copy());
        for (NetworkServiceSliver ns : other.networkServices.values())
            addNetworkService(ns.copy());
    }

    @Override
    public SliverKind getKind() {
        return SliverKind.Node;
    }

    @Override
    public NodeSliver copy() {
        return new NodeSliver(this);
    }

    public NodeType getType() {
        return type;
    }

    public void setType(NodeType type) {
        this.type = type;
    }

    public String getSite() {
        return site;
    }

    public void setSite(String site) {
        this.site = site;
    }

    public String getManagementIp() {
        return managementIp;
    }

    public void setManagementIp(String managementIp) {
        this.managementIp = managementIp;
    }

    public NodeSliver addComponent(ComponentSliver component) {
        components.put(component.getName(), component);
        return this;
    }

    public ComponentSliver getComponent(String name) {
        return components.get(name);
    }

    public List<ComponentSliver> getComponents() {
        return Collections.unmodifiableList(new ArrayList<>(components.values()));
    }

    public NodeSliver addNetworkService(NetworkServiceSliver ns) {
        networkServices.put(ns.getName(), ns);
        return this;
    }

    public List<NetworkServiceSliver> getNetworkServices() {
        return Collections.unmodifiableList(new ArrayList<>(networkServices.values()));
    }
}
