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

import com.netflix.lessor.AllocationResult;
import com.netflix.lessor.FailureKind;
import com.netflix.lessor.ReservationProvider;
import com.netflix.lessor.ReservationRef;
import com.netflix.lessor.slivers.Capacities;
import com.netflix.lessor.slivers.ComponentSliver;
import com.netflix.lessor.slivers.ComponentType;
import com.netflix.lessor.slivers.InterfaceSliver;
import com.netflix.lessor.slivers.Labels;
import com.netflix.lessor.slivers.NetworkServiceLayer;
import com.netflix.lessor.slivers.NetworkServiceSliver;
import com.netflix.lessor.slivers.NodeMap;
import com.netflix.lessor.slivers.NodeSliver;
import com.netflix.lessor.slivers.NodeType;
import com.netflix.lessor.slivers.ServiceType;
import org.junit.Test;
import org.slf4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.netflix.lessor.inventory.SliverProvider.GRAPH_ID;
import static com.netflix.lessor.inventory.SliverProvider.cpu;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class NetworkNodeInventoryTest {

    private final NetworkNodeInventory inventory = new NetworkNodeInventory.Builder().build();

    private static final Map<String, List<String>> NONE = Collections.emptyMap();

    private AllocationResult<NodeSliver> create(String rid, NodeSliver request, NodeSliver candidate,
                                                List<? extends ReservationRef> existing) {
        return inventory.allocate(rid, request, GRAPH_ID, candidate, existing, NONE, ReservationOperation.Create);
    }

    private static NodeSliver allocatedOn(String nodeId, Capacities capacities, ComponentSliver... components) {
        NodeSliver allocated = SliverProvider.vm("allocated", capacities, components);
        allocated.setCapacityAllocations(capacities);
        allocated.setNodeMap(new NodeMap(GRAPH_ID, nodeId));
        return allocated;
    }

    @Test
    public void testCapacityNetOfActiveReservation() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(4));
        List<ReservationRef> existing = Collections.<ReservationRef>singletonList(
                ReservationProvider.getActive("r1", allocatedOn("server1", cpu(1))));

        AllocationResult<NodeSliver> fits = create("r2", SliverProvider.vm("vm", cpu(3)), server, existing);
        assertThat(fits.isSuccessful(), is(true));
        assertThat(fits.getDelegationId(), is("D1"));
        NodeSliver vm = fits.get();
        assertThat(vm.getCapacityAllocations(), is(cpu(3)));
        assertThat(vm.getNodeMap(), is(new NodeMap(GRAPH_ID, "server1")));
        assertThat(vm.getLabelAllocations().getInstanceParent(), is("server-server1"));

        AllocationResult<NodeSliver> tooBig = create("r2", SliverProvider.vm("vm", cpu(4)), server, existing);
        assertThat(tooBig.getFailure().getKind(), is(FailureKind.InsufficientResources));
        assertThat(tooBig.getFailure().getResources(), is(Collections.singletonList("cpu")));
    }

    @Test
    public void testCapacityConservation() throws Exception {
        Capacities pool = new Capacities.Builder().withCore(10).withRam(64).build();
        NodeSliver server = SliverProvider.server("server1", pool);
        List<ReservationRef> existing = Arrays.<ReservationRef>asList(
                ReservationProvider.getActive("active", allocatedOn("server1",
                        new Capacities.Builder().withCore(2).withRam(8).build())),
                ReservationProvider.getTicketing("ticketing", allocatedOn("server1",
                        new Capacities.Builder().withCore(3).withRam(8).build())),
                ReservationProvider.getClosed("closed", allocatedOn("server1",
                        new Capacities.Builder().withCore(5).build())),
                ReservationProvider.getActive("elsewhere", allocatedOn("server2",
                        new Capacities.Builder().withCore(5).build())));

        Capacities exact = new Capacities.Builder().withCore(5).withRam(48).build();
        assertThat(create("new", SliverProvider.vm("vm", exact), server, existing).isSuccessful(), is(true));

        Capacities oneMore = new Capacities.Builder().withCore(6).withRam(48).build();
        AllocationResult<NodeSliver> result = create("new", SliverProvider.vm("vm", oneMore), server, existing);
        assertThat(result.getFailure().getKind(), is(FailureKind.InsufficientResources));
        assertThat(result.getFailure().getResources(), is(Collections.singletonList("core")));
    }

    @Test
    public void testExtendingReservationCountsItsRequest() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(8));
        List<ReservationRef> existing = Collections.<ReservationRef>singletonList(
                ReservationProvider.getExtending("ext", allocatedOn("server1", cpu(1)), allocatedOn("server1", cpu(5))));
        assertThat(create("new", SliverProvider.vm("vm", cpu(3)), server, existing).isSuccessful(), is(true));
        assertThat(create("new", SliverProvider.vm("vm", cpu(4)), server, existing).isSuccessful(), is(false));
    }

    @Test
    public void testOwnReservationIsNotSubtracted() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(4));
        List<ReservationRef> existing = Collections.<ReservationRef>singletonList(
                ReservationProvider.getActive("r1", allocatedOn("server1", cpu(4))));
        AllocationResult<NodeSliver> result = inventory.allocate("r1", SliverProvider.vm("vm", cpu(4)), GRAPH_ID,
                server, existing, NONE, ReservationOperation.Extend);
        assertThat(result.isSuccessful(), is(true));
    }

    @Test
    public void testInvalidArguments() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(4));
        NetworkServiceSliver ns = new NetworkServiceSliver("ns", ServiceType.L2PTP, NetworkServiceLayer.L2);
        assertThat(create("r", null, server, null).getFailure().getKind(), is(FailureKind.InvalidArgument));
        assertThat(inventory.allocate("r", ns, GRAPH_ID, server, null, null, ReservationOperation.Create)
                .getFailure().getKind(), is(FailureKind.InvalidArgument));

        NodeSliver facility = new NodeSliver("facility", NodeType.Facility);
        assertThat(create("r", facility, server, null).getFailure().getKind(), is(FailureKind.InvalidArgument));

        NodeSliver bare = new NodeSliver("bare", NodeType.Server);
        AllocationResult<NodeSliver> result = create("r", SliverProvider.vm("vm", cpu(1)), bare, null);
        assertThat(result.getFailure().getKind(), is(FailureKind.InvalidArgument));
        assertThat(result.getFailure().getMessage(), containsString("capacity delegation"));
    }

    @Test
    public void testRequestIsNotModified() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(4),
                SliverProvider.dedicated("gpu1", ComponentType.GPU, "Tesla T4"));
        NodeSliver request = SliverProvider.vm("vm", cpu(1),
                SliverProvider.requested("gpu", ComponentType.GPU, "Tesla T4"));
        NodeSliver result = create("r", request, server, null).get();
        assertThat(result.getComponent("gpu").getNodeMap(), is(new NodeMap(GRAPH_ID, "gpu1")));
        assertThat(request.getComponent("gpu").getNodeMap(), is(nullValue()));
        assertThat(request.getNodeMap(), is(nullValue()));
    }

    @Test
    public void testDedicatedComponentsAreExclusive() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.dedicated("gpu1", ComponentType.GPU, "Tesla T4"),
                SliverProvider.dedicated("gpu2", ComponentType.GPU, "Tesla T4"),
                SliverProvider.dedicated("nvme1", ComponentType.NVME, "P4510"));

        NodeSliver two = create("r1", SliverProvider.vm("vm", cpu(1),
                SliverProvider.requested("a", ComponentType.GPU, "Tesla T4"),
                SliverProvider.requested("b", ComponentType.GPU, "Tesla T4")), server, null).get();
        assertThat(two.getComponent("a").getNodeMap().getNodeId(), is("gpu1"));
        assertThat(two.getComponent("b").getNodeMap().getNodeId(), is("gpu2"));
        assertThat(two.getComponent("a").getLabelAllocations().getBdf(), is("0000:81:00.0"));
        assertThat(two.getComponent("a").getCapacityAllocations(), is(Capacities.ofUnits(1)));

        List<ReservationRef> existing = Collections.<ReservationRef>singletonList(
                ReservationProvider.getActive("r1", two));
        AllocationResult<NodeSliver> result = create("r2", SliverProvider.vm("vm", cpu(1),
                SliverProvider.requested("c", ComponentType.GPU, "Tesla T4")), server, existing);
        assertThat(result.getFailure().getKind(), is(FailureKind.InsufficientResources));
        assertThat(result.getFailure().getResources(), is(Collections.singletonList("c")));

        AllocationResult<NodeSliver> nvme = create("r2", SliverProvider.vm("vm", cpu(1),
                SliverProvider.requested("d", ComponentType.NVME, null)), server, existing);
        assertThat(nvme.get().getComponent("d").getNodeMap().getNodeId(), is("nvme1"));
    }

    @Test
    public void testModelMustMatch() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.dedicated("gpu1", ComponentType.GPU, "Tesla T4"));
        AllocationResult<NodeSliver> result = create("r", SliverProvider.vm("vm", cpu(1),
                SliverProvider.requested("a", ComponentType.GPU, "RTX6000")), server, null);
        assertThat(result.getFailure().getKind(), is(FailureKind.InsufficientResources));
        assertThat(result.getFailure().getMessage(), containsString("RTX6000"));
    }

    @Test
    public void testSharedNicPciExclusivity() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.sharedNic("nic1", "ConnectX-6", "1001", "1002"));
        NodeSliver first = create("r1", SliverProvider.vm("vm1", cpu(1), SliverProvider.requestedNic("n",
                ComponentType.SharedNIC, "ConnectX-6", NetworkServiceLayer.L2, 1, null, "192.168.1.10")), server,
                null).get();
        ComponentSliver nic = first.getComponent("n");
        assertThat(nic.getLabelAllocations().getBdf(), is("0000:41:00.2"));
        assertThat(nic.getLabelAllocations().getNuma(), is("1"));
        assertThat(nic.getCapacityAllocations(), is(Capacities.ofUnits(1)));
        assertThat(nic.getNodeMap(), is(new NodeMap(GRAPH_ID, "nic1")));
        InterfaceSliver ifs = nic.getNetworkServices().get(0).getInterfaces().get(0);
        assertThat(ifs.getLabelAllocations().getMac(), is("0C:42:A1:00:00:00"));
        assertThat(ifs.getLabelAllocations().getVlan(), is("1001"));
        assertThat(ifs.getLabelAllocations().getLocalName(), is("p1.0"));
        assertThat(ifs.getLabelAllocations().getIpv4(), is("192.168.1.10"));
        assertThat(ifs.getNodeMap(), is(new NodeMap(GRAPH_ID, "nic1-p1")));

        List<ReservationRef> existing = Collections.<ReservationRef>singletonList(
                ReservationProvider.getActive("r1", first));
        NodeSliver second = create("r2", SliverProvider.vm("vm2", cpu(1), SliverProvider.requestedNic("n",
                ComponentType.SharedNIC, "ConnectX-6", NetworkServiceLayer.L3, 1, null, null)), server,
                existing).get();
        String secondBdf = second.getComponent("n").getLabelAllocations().getBdf();
        assertThat(secondBdf, is("0000:41:00.3"));
        assertThat(secondBdf, is(not(nic.getLabelAllocations().getBdf())));

        List<ReservationRef> both = Arrays.<ReservationRef>asList(ReservationProvider.getActive("r1", first),
                ReservationProvider.getActive("r2", second));
        AllocationResult<NodeSliver> third = create("r3", SliverProvider.vm("vm3", cpu(1),
                SliverProvider.requested("n", ComponentType.SharedNIC, "ConnectX-6")), server, both);
        assertThat(third.getFailure().getKind(), is(FailureKind.InsufficientResources));
    }

    @Test
    public void testSharedNicPrefersAddressOfRequestedVlan() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.sharedNic("nic1", "ConnectX-6", "1001", "1002", "1003"));
        NodeSliver vm = create("r1", SliverProvider.vm("vm1", cpu(1), SliverProvider.requestedNic("n",
                ComponentType.SharedNIC, "ConnectX-6", NetworkServiceLayer.L3, 1, "1003", null)), server,
                null).get();
        assertThat(vm.getComponent("n").getLabelAllocations().getBdf(), is("0000:41:00.4"));
        InterfaceSliver ifs = vm.getComponent("n").getNetworkServices().get(0).getInterfaces().get(0);
        assertThat(ifs.getLabelAllocations().getVlan(), is("1003"));
        assertThat(ifs.getLabelAllocations().getIpv4(), is(nullValue()));
    }

    @Test
    public void testOpenStackSharedNicCarriesNoVlan() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.sharedNic("nic1", "OpenStack-vNIC", "1001"));
        NodeSliver vm = create("r1", SliverProvider.vm("vm1", cpu(1), SliverProvider.requestedNic("n",
                ComponentType.SharedNIC, "OpenStack-vNIC", NetworkServiceLayer.L2, 1, null, null)), server,
                null).get();
        InterfaceSliver ifs = vm.getComponent("n").getNetworkServices().get(0).getInterfaces().get(0);
        assertThat(ifs.getLabelAllocations().getVlan(), is(nullValue()));
        assertThat(ifs.getLabelAllocations().getBdf(), is("0000:41:00.2"));
    }

    @Test
    public void testSharedNicWithoutSinglePortFails() throws Exception {
        ComponentSliver nic = new ComponentSliver("nic1", ComponentType.SharedNIC, "ConnectX-6");
        nic.setNodeId("nic1");
        nic.setLabelDelegations(SliverProvider.delegated(
                new Labels.Builder().withBdf("0000:41:00.2").build()));
        NodeSliver server = SliverProvider.server("server1", cpu(16), nic);
        AllocationResult<NodeSliver> result = create("r1", SliverProvider.vm("vm1", cpu(1),
                SliverProvider.requested("n", ComponentType.SharedNIC, "ConnectX-6")), server, null);
        assertThat(result.getFailure().getKind(), is(FailureKind.Failure));
    }

    @Test
    public void testComponentsUsedByOtherServicesAreExcluded() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.sharedNic("nic1", "ConnectX-6", "1001", "1002"),
                SliverProvider.dedicated("gpu1", ComponentType.GPU, "Tesla T4"));
        Map<String, List<String>> inUse = new HashMap<>();
        inUse.put("nic1", Collections.singletonList("0000:41:00.2"));
        inUse.put("gpu1", Collections.<String>emptyList());

        NodeSliver vm = inventory.allocate("r1", SliverProvider.vm("vm1", cpu(1),
                SliverProvider.requested("n", ComponentType.SharedNIC, "ConnectX-6")), GRAPH_ID, server, null, inUse,
                ReservationOperation.Create).get();
        assertThat(vm.getComponent("n").getLabelAllocations().getBdf(), is("0000:41:00.3"));

        AllocationResult<NodeSliver> gpu = inventory.allocate("r1", SliverProvider.vm("vm1", cpu(1),
                SliverProvider.requested("g", ComponentType.GPU, null)), GRAPH_ID, server, null, inUse,
                ReservationOperation.Create);
        assertThat(gpu.getFailure().getKind(), is(FailureKind.InsufficientResources));
    }

    @Test
    public void testSmartNicPortsArePaired() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.smartNic("snic1", "ConnectX-5", 2));
        NodeSliver vm = create("r1", SliverProvider.vm("vm1", cpu(1), SliverProvider.requestedNic("s",
                ComponentType.SmartNIC, "ConnectX-5", NetworkServiceLayer.L2, 2, "200", "10.0.0.5")), server,
                null).get();
        ComponentSliver nic = vm.getComponent("s");
        assertThat(nic.getNodeMap().getNodeId(), is("snic1"));
        List<InterfaceSliver> ports = nic.getNetworkServices().get(0).getInterfaces();
        for (int i = 0; i < 2; i++) {
            assertThat(ports.get(i).getNodeMap().getNodeId(), is("snic1-p" + i));
            assertThat(ports.get(i).getLabelAllocations().getMac(), is("04:3F:72:00:00:0" + i));
            assertThat(ports.get(i).getLabelAllocations().getLocalName(), is("p" + i));
            assertThat(ports.get(i).getLabelAllocations().getVlan(), is("200"));
            assertThat(ports.get(i).getLabelAllocations().getIpv4(), is("10.0.0.5"));
        }

        AllocationResult<NodeSliver> noService = create("r2", SliverProvider.vm("vm2", cpu(1),
                SliverProvider.requested("s", ComponentType.SmartNIC, "ConnectX-5")), server, null);
        assertThat(noService.getFailure().getKind(), is(FailureKind.Failure));
    }

    @Test
    public void testSmartNicL3CarriesNoRequestedVlan() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.smartNic("snic1", "ConnectX-5", 2));
        NodeSliver vm = create("r1", SliverProvider.vm("vm1", cpu(1), SliverProvider.requestedNic("s",
                ComponentType.SmartNIC, "ConnectX-5", NetworkServiceLayer.L3, 1, "200", "10.0.0.5")), server,
                null).get();
        InterfaceSliver port = vm.getComponent("s").getNetworkServices().get(0).getInterfaces().get(0);
        assertThat(port.getLabelAllocations().getBdf(), is("0000:e2:00.0"));
        assertThat(port.getLabelAllocations().getMac(), is("04:3F:72:00:00:00"));
        assertThat(port.getLabelAllocations().getVlan(), is(nullValue()));
        assertThat(port.getLabelAllocations().getIpv4(), is(nullValue()));
        assertThat(port.getNodeMap().getNodeId(), is("snic1-p0"));
    }

    @Test
    public void testStorageTakesOneUnit() throws Exception {
        ComponentSliver volume = new ComponentSliver("nas", ComponentType.Storage, "NAS");
        volume.setNodeId("nas");
        NodeSliver server = SliverProvider.server("server1", cpu(16), volume);
        NodeSliver vm = create("r1", SliverProvider.vm("vm1", cpu(1),
                SliverProvider.requested("disk", ComponentType.Storage, "NAS")), server, null).get();
        assertThat(vm.getComponent("disk").getCapacityAllocations(), is(Capacities.ofUnits(1)));
        assertThat(vm.getComponent("disk").getNodeMap().getNodeId(), is("nas"));
    }

    @Test
    public void testModifyKeepsBoundComponents() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.dedicated("gpu1", ComponentType.GPU, "Tesla T4"),
                SliverProvider.dedicated("gpu2", ComponentType.GPU, "Tesla T4"));
        NodeSliver current = create("r1", SliverProvider.vm("vm1", cpu(1),
                SliverProvider.requested("a", ComponentType.GPU, null)), server, null).get();

        NodeSliver modified = current.copy();
        modified.addComponent(SliverProvider.requested("b", ComponentType.GPU, null));
        List<ReservationRef> existing = Collections.<ReservationRef>singletonList(
                ReservationProvider.getActive("r1", current));
        NodeSliver result = inventory.allocate("r1", modified, GRAPH_ID, server, existing, NONE,
                ReservationOperation.Modify).get();
        assertThat(result.getComponent("a").getNodeMap().getNodeId(), is("gpu1"));
        assertThat(result.getComponent("b").getNodeMap().getNodeId(), is("gpu2"));
        assertThat(result.getLabelAllocations().getInstanceParent(), is("server-server1"));
    }

    @Test
    public void testExtendRequiresExclusiveComponents() throws Exception {
        NodeSliver server = SliverProvider.server("server1", cpu(16),
                SliverProvider.sharedNic("nic1", "ConnectX-6", "1001", "1002"));
        NodeSliver current = create("r1", SliverProvider.vm("vm1", cpu(1),
                SliverProvider.requested("n", ComponentType.SharedNIC, null)), server, null).get();

        List<ReservationRef> mine = Collections.<ReservationRef>singletonList(
                ReservationProvider.getActive("r1", current));
        AllocationResult<NodeSliver> renewed = inventory.allocate("r1", current, GRAPH_ID, server, mine, NONE,
                ReservationOperation.Extend);
        assertThat(renewed.isSuccessful(), is(true));
        assertThat(renewed.get().getComponent("n").getLabelAllocations().getBdf(), is("0000:41:00.2"));

        NodeSliver thief = current.copy();
        List<ReservationRef> conflicting = Arrays.<ReservationRef>asList(ReservationProvider.getActive("r1", current),
                ReservationProvider.getActive("r9", thief));
        AllocationResult<NodeSliver> failed = inventory.allocate("r1", current, GRAPH_ID, server, conflicting, NONE,
                ReservationOperation.Extend);
        assertThat(failed.getFailure().getKind(), is(FailureKind.InsufficientResources));
    }

    @Test
    public void testSwitchIsStampedWithoutComponents() throws Exception {
        NodeSliver candidate = new NodeSliver("switch-a", NodeType.Switch);
        candidate.setNodeId("sw1");
        candidate.setManagementIp("192.168.11.3");
        candidate.setCapacityDelegations(SliverProvider.delegated(Capacities.ofUnits(1)));
        NodeSliver request = new NodeSliver("p4", NodeType.Switch);
        request.setCapacities(Capacities.ofUnits(1));

        AllocationResult<NodeSliver> result = create("r1", request, candidate, null);
        NodeSliver allocated = result.get();
        assertThat(result.getDelegationId(), is("D1"));
        assertThat(allocated.getNodeMap(), is(new NodeMap(GRAPH_ID, "sw1")));
        assertThat(allocated.getManagementIp(), is("192.168.11.3"));
        assertThat(allocated.getCapacityAllocations(), is(Capacities.ofUnits(1)));
        assertThat(allocated.getLabelAllocations().getLocalName(), is("switch-a"));

        List<ReservationRef> existing = Collections.<ReservationRef>singletonList(
                ReservationProvider.getActive("r1", allocated));
        assertThat(create("r2", request, candidate, existing).getFailure().getResources(),
                is(Collections.singletonList("unit")));
    }

    @Test
    public void testFailuresAreLoggedToInjectedLogger() throws Exception {
        Logger logger = mock(Logger.class);
        NetworkNodeInventory logged = new NetworkNodeInventory.Builder().withLogger(logger).build();
        NodeSliver server = SliverProvider.server("server1", cpu(1));
        logged.allocate("r1", SliverProvider.vm("vm", cpu(1)), GRAPH_ID, server, null, null,
                ReservationOperation.Create);
        verify(logger, never()).info(anyString());
        logged.allocate("r1", SliverProvider.vm("vm", cpu(2)), GRAPH_ID, server, null, null,
                ReservationOperation.Create);
        verify(logger).info(anyString());
    }
}
