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
import java.util.List;

/**
 * A request-or-allocation descriptor for one resource. A sliver carries the requested view ({@link #getCapacities()},
 * {@link #getLabels()}) and, once allocated, the allocation view ({@link #getCapacityAllocations()},
 * {@link #getLabelAllocations()}) together with the {@link NodeMap} of the substrate element it was bound to.
 * Slivers that describe substrate elements also carry the delegations they advertise.
 * <P>
 * Slivers are mutable. Allocators never annotate the sliver they were given; they annotate a {@link #copy()}.
 */
public abstract class BaseSliver {
    private String name;
    private String nodeId;
    private Capacities capacities;
    private Labels labels;
    private Capacities capacityAllocations;
    private Labels labelAllocations;
    private List<Delegation<Capacities>> capacityDelegations = Collections.emptyList();
    private List<Delegation<Labels>> labelDelegations = Collections.emptyList();
    private NodeMap nodeMap;

    protected BaseSliver(String name) {
        this.name = name;
    }

    protected BaseSliver(BaseSliver other) {
        this.name = other.name;
        this.nodeId = other.nodeId;
        this.capacities = other.capacities;
        this.labels = other.labels;
        this.capacityAllocations = other.capacityAllocations;
        this.labelAllocations = other.labelAllocations;
        this.capacityDelegations = other.capacityDelegations;
        this.labelDelegations = other.labelDelegations;
        this.nodeMap = other.nodeMap;
    }

    /**
     * Get the kind of this sliver.
     *
     * @return the sliver kind
     */
    public abstract SliverKind getKind();

    /**
     * Create a deep copy of this sliver, including nested slivers.
     *
     * @return a copy that shares no mutable state with this sliver
     */
    public abstract BaseSliver copy();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Get the identifier of this element in the substrate model. Set on substrate descriptors, not on requests.
     *
     * @return node identifier
     */
    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public Capacities getCapacities() {
        return capacities;
    }

    public void setCapacities(Capacities capacities) {
        this.capacities = capacities;
    }

    public Labels getLabels() {
        return labels;
    }

    public void setLabels(Labels labels) {
        this.labels = labels;
    }

    public Capacities getCapacityAllocations() {
        return capacityAllocations;
    }

    public void setCapacityAllocations(Capacities capacityAllocations) {
        this.capacityAllocations = capacityAllocations;
    }

    public Labels getLabelAllocations() {
        return labelAllocations;
    }

    public void setLabelAllocations(Labels labelAllocations) {
        this.labelAllocations = labelAllocations;
    }

    public List<Delegation<Capacities>> getCapacityDelegations() {
        return capacityDelegations;
    }

    public void setCapacityDelegations(List<Delegation<Capacities>> capacityDelegations) {
        this.capacityDelegations = capacityDelegations == null ?
                Collections.emptyList() :
                Collections.unmodifiableList(new ArrayList<>(capacityDelegations));
    }

    public List<Delegation<Labels>> getLabelDelegations() {
        return labelDelegations;
    }

    public void setLabelDelegations(List<Delegation<Labels>> labelDelegations) {
        this.labelDelegations = labelDelegations == null ?
                Collections.emptyList() :
                Collections.unmodifiableList(new ArrayList<>(labelDelegations));
    }

    public NodeMap getNodeMap() {
        return nodeMap;
    }

    public void setNodeMap(NodeMap nodeMap) {
        this.nodeMap = nodeMap;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "name='" + name + '\'' +
                ", nodeId=" + nodeId +
                ", capacities=" + capacities +
                ", capacityAllocations=" + capacityAllocations +
                ", labelAllocations=" + labelAllocations +
                ", nodeMap=" + nodeMap +
                '}';
    }
}
