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

package com.netflix.lessor.inventory;

import com.netflix.lessor.slivers.Capacities;
import com.netflix.lessor.slivers.ComponentSliver;
import com.netflix.lessor.slivers.ComponentType;
import com.netflix.lessor.slivers.Delegation;
import com.netflix.lessor.slivers.InterfaceSliver;
import com.netflix.lessor.slivers.InterfaceType;
import com.netflix.lessor.slivers.Labels;
import com.netflix.lessor.slivers.NetworkServiceLayer;
import com.netflix.lessor.slivers.NetworkServiceSliver;
import com.netflix.lessor.slivers.NodeSliver;
import com.netflix.lessor.slivers.NodeType;
import com.netflix.lessor.slivers.ServiceType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class SliverProvider {

    public static final String GRAPH_ID = "site-graph";

    public static Capacities cpu(int cpu) {
        return new Capacities.Builder().withCpu(cpu).build();
    }

    public static NodeSliver server(String nodeId, Capacities pool, ComponentSliver... components) {
        NodeSliver server = new NodeSliver("server-" + nodeId, NodeType.Server);
        server.setNodeId(nodeId);
        server.setCapacityDelegations(Collections.singletonList(new Delegation<>("D1", pool)));
        for (ComponentSliver component : components)
            server.addComponent(component);
        return server;
    }

    public static NodeSliver vm(String name, Capacities capacities, ComponentSliver... components) {
        NodeSliver vm = new NodeSliver(name, NodeType.VM);
        vm.setCapacities(capacities);
        for (ComponentSliver component : components)
            vm.addComponent(component);
        return vm;
    }

    public static <T> List<Delegation<T>> delegated(T pool) {
        return Collections.singletonList(new Delegation<>("D1", pool));
    }

    /**
     * A substrate shared NIC with one PCI address per VLAN; port labels at index i belong to the address at
     * index i.
     */
    public static ComponentSliver sharedNic(String nodeId, String model, String... vlans) {
        List<String> bdfs = new ArrayList<>();
        List<String> numas = new ArrayList<>();
        List<String> macs = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < vlans.length; i++) {
            bdfs.add("0000:41:00." + (i + 2));
            numas.add("1");
            macs.add("0C:42:A1:00:00:0" + i);
            names.add("p1." + i);
        }
        ComponentSliver nic = new ComponentSliver(nodeId, ComponentType.SharedNIC, model);
        nic.setNodeId(nodeId);
        nic.setLabelDelegations(delegated(new Labels.Builder().withBdfs(bdfs).withNumas(numas).build()));
        nic.setCapacityDelegations(delegated(Capacities.ofUnits(vlans.length)));
        InterfaceSliver port = new InterfaceSliver(nodeId + "-p1", InterfaceType.SharedPort);
        port.setNodeId(nodeId + "-p1");
        port.setLabelDelegations(delegated(new Labels.Builder().withMacs(macs).withVlans(Arrays.asList(vlans))
                .withLocalNames(names).build()));
        nic.addNetworkService(new NetworkServiceSliver(nodeId + "-l2", ServiceType.L2Bridge, NetworkServiceLayer.L2)
                .addInterface(port));
        return nic;
    }

    public static ComponentSliver dedicated(String nodeId, ComponentType type, String model) {
        ComponentSliver component = new ComponentSliver(nodeId, type, model);
        component.setNodeId(nodeId);
        component.setLabelDelegations(delegated(new Labels.Builder().withBdf("0000:81:00.0").withNuma("0").build()));
        component.setCapacityDelegations(delegated(Capacities.ofUnits(1)));
        return component;
    }

    public static ComponentSliver smartNic(String nodeId, String model, int ports) {
        ComponentSliver nic = new ComponentSliver(nodeId, ComponentType.SmartNIC, model);
        nic.setNodeId(nodeId);
        nic.setLabelDelegations(delegated(new Labels.Builder().withBdfs(Arrays.asList("0000:e2:00.0",
                "0000:e2:00.1")).build()));
        NetworkServiceSliver ns = new NetworkServiceSliver(nodeId + "-l2", ServiceType.L2Bridge, NetworkServiceLayer.L2);
        for (int i = 0; i < ports; i++) {
            InterfaceSliver port = new InterfaceSliver(nodeId + "-p" + i, InterfaceType.DedicatedPort);
            port.setNodeId(nodeId + "-p" + i);
            port.setLabelDelegations(delegated(new Labels.Builder().withBdf("0000:e2:00." + i)
                    .withMac("04:3F:72:00:00:0" + i).withLocalName("p" + i).withVlanRange("1-4096").build()));
            ns.addInterface(port);
        }
        nic.addNetworkService(ns);
        return nic;
    }

    public static ComponentSliver requested(String name, ComponentType type, String model) {
        return new ComponentSliver(name, type, model);
    }

    /**
     * A requested NIC with a single interface, optionally asking for a VLAN and an address.
     */
    public static ComponentSliver requestedNic(String name, ComponentType type, String model, NetworkServiceLayer layer,
                                               int interfaces, String vlan, String ipv4) {
        ComponentSliver nic = new ComponentSliver(name, type, model);
        NetworkServiceSliver ns = new NetworkServiceSliver(name + "-l2", ServiceType.L2Bridge, layer);
        for (int i = 0; i < interfaces; i++) {
            InterfaceSliver ifs = new InterfaceSliver(name + "-p" + i, InterfaceType.DedicatedPort);
            ifs.setLabels(new Labels.Builder().withVlan(vlan).withIpv4(ipv4).build());
            ns.addInterface(ifs);
        }
        nic.addNetworkService(ns);
        return nic;
    }
}
