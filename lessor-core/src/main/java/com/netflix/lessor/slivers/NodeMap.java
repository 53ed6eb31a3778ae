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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Records which substrate element a sliver was bound to: the delegation graph it came from and the identifier
 * of the node within that graph.
 */
public class NodeMap {
    private final String graphId;
    private final String nodeId;

    @JsonCreator
    public NodeMap(@JsonProperty("graphId") String graphId, @JsonProperty("nodeId") String nodeId) {
        this.graphId = graphId;
        this.nodeId = nodeId;
    }

    public String getGraphId() {
        return graphId;
    }

    public String getNodeId() {
        return nodeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        NodeMap nodeMap = (NodeMap) o;
        return Objects.equals(graphId, nodeMap.graphId) && Objects.equals(nodeId, nodeMap.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(graphId, nodeId);
    }

    @Override
    public String toString() {
        return "(" + graphId + ", " + nodeId + ")";
    }
}
