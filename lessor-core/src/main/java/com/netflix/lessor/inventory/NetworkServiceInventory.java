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

import com.netflix.lessor.AllocationFailure;
import com.netflix.lessor.AllocationResult;
import com.netflix.lessor.FailureKind;
import com.netflix.lessor.ReservationRef;
import com.netflix.lessor.slivers.BaseSliver;
import com.netflix.lessor.slivers.Delegation;
import com.netflix.lessor.slivers.Delegations;
import com.netflix.lessor.slivers.Gateway;
import com.netflix.lessor.slivers.InterfaceSliver;
import com.netflix.lessor.slivers.InterfaceType;
import com.netflix.lessor.slivers.Labels;
import com.netflix.lessor.slivers.NetworkServiceLayer;
import com.netflix.lessor.slivers.NetworkServiceSliver;
import com.netflix.lessor.slivers.NodeSliver;
import com.netflix.lessor.slivers.ServiceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Allocates VLAN tags to interfaces and subnets to routed network services on a substrate switch, excluding values
 * already committed to other reservations served by the same switch.
 * <P>
 * Allocation never modifies its arguments: results are returned as annotated copies of the requested slivers.
 * Instances are stateless between calls and may be shared.
 */
public class NetworkServiceInventory {

    /**
     * The builder for {@link NetworkServiceInventory}.
     */
    public final static class Builder {
        private Logger logger = LoggerFactory.getLogger(NetworkServiceInventory.class);
        private int ipv4SubnetPrefix = 24;
        private int ipv6SubnetPrefix = 64;
        private int reservedSubnets = 1;
        private boolean lenientVlanExhaustion = false;
        private String defaultVlanRange = "1-4095";

        /**
         * Use the given logger instead of the class logger.
         *
         * @param logger the logger to use
         * @return this same {@code Builder}, suitable for further chaining
         */
        public Builder withLogger(Logger logger) {
            this.logger = logger;
            return this;
        }

        /**
         * Set the prefix length of the IPv4 sub-blocks handed out to FABNetv4 services. The default is 24.
         *
         * @param prefix the prefix length
         * @return this same {@code Builder}, suitable for further chaining
         */
        public Builder withIpv4SubnetPrefix(int prefix) {
            this.ipv4SubnetPrefix = prefix;
            return this;
        }

        /**
         * Set the prefix length of the IPv6 sub-blocks handed out to FABNetv6 services. The default is 64.
         *
         * @param prefix the prefix length
         * @return this same {@code Builder}, suitable for further chaining
         */
        public Builder withIpv6SubnetPrefix(int prefix) {
            this.ipv6SubnetPrefix = prefix;
            return this;
        }

        /**
         * Set how many leading sub-blocks of a delegated subnet are kept out of allocation for control plane use.
         * The default is 1.
         *
         * @param reservedSubnets the number of leading sub-blocks to skip
         * @return this same {@code Builder}, suitable for further chaining
         */
        public Builder withReservedSubnets(int reservedSubnets) {
            this.reservedSubnets = reservedSubnets;
            return this;
        }

        /**
         * When set, a routed interface whose VLAN range is exhausted is returned without a VLAN instead of failing
         * the allocation.
         *
         * @param lenient whether VLAN exhaustion on routed services is tolerated
         * @return this same {@code Builder}, suitable for further chaining
         */
        public Builder withLenientVlanExhaustion(boolean lenient) {
            this.lenientVlanExhaustion = lenient;
            return this;
        }

        /**
         * Set the VLAN range accepted for layer 2 services whose MPLS service carries no delegated range.
         *
         * @param vlanRange range in the form {@code low-high}, both ends included
         * @return this same {@code Builder}, suitable for further chaining
         */
        public Builder withDefaultVlanRange(String vlanRange) {
            VlanRange.parse(vlanRange);
            this.defaultVlanRange = vlanRange;
            return this;
        }

        public NetworkServiceInventory build() {
            if (ipv4SubnetPrefix < 1 || ipv4SubnetPrefix > 32)
                throw new IllegalArgumentException("Invalid IPv4 sub-block prefix " + ipv4SubnetPrefix);
            if (ipv6SubnetPrefix < 1 || ipv6SubnetPrefix > 128)
                throw new IllegalArgumentException("Invalid IPv6 sub-block prefix " + ipv6SubnetPrefix);
            if (reservedSubnets < 0)
                throw new IllegalArgumentException("Negative number of reserved sub-blocks " + reservedSubnets);
            return new NetworkServiceInventory(this);
        }
    }

    private final Logger logger;
    private final int ipv4SubnetPrefix;
    private final int ipv6SubnetPrefix;
    private final int reservedSubnets;
    private final boolean lenientVlanExhaustion;
    private final VlanRange defaultVlanRange;

    private NetworkServiceInventory(Builder builder) {
        this.logger = builder.logger;
        this.ipv4SubnetPrefix = builder.ipv4SubnetPrefix;
        this.ipv6SubnetPrefix = builder.ipv6SubnetPrefix;
        this.reservedSubnets = builder.reservedSubnets;
        this.lenientVlanExhaustion = builder.lenientVlanExhaustion;
        this.defaultVlanRange = VlanRange.parse(builder.defaultVlanRange);
    }

    /**
     * Allocate the VLAN of an interface of a network service.
     * <P>
     * For layer 2 services the requested VLAN, if any, is validated: it must fall within the range delegated on
     * the MPLS service (not checked for facility ports) and within the range delegated on the candidate interface,
     * and must not be allocated already to another reservation on that interface.
     * <P>
     * For layer 3 services the first VLAN of the range delegated to the switch's service of the requested type
     * that no other reservation uses on the candidate interface is assigned. A switch without a service of that
     * type, or a service without a delegated VLAN range, fails the allocation with {@link FailureKind#Failure}
     * rather than returning the interface without a VLAN.
     *
     * @param requestedNs the requested network service
     * @param requestedIfs the requested interface
     * @param ownerSwitch the substrate switch serving the interface
     * @param mplsNs the substrate MPLS service of the switch
     * @param candidateIfs the substrate interface chosen for the requested interface
     * @param existingReservations reservations already served by the switch
     * @return a copy of the requested interface with its VLAN allocated, or the reason it could not be
     */
    public AllocationResult<InterfaceSliver> allocateInterface(NetworkServiceSliver requestedNs,
                                                               InterfaceSliver requestedIfs,
                                                               NodeSliver ownerSwitch,
                                                               NetworkServiceSliver mplsNs,
                                                               InterfaceSliver candidateIfs,
                                                               List<? extends ReservationRef> existingReservations) {
        if (requestedNs == null || requestedIfs == null || candidateIfs == null)
            return AllocationResult.error(FailureKind.InvalidArgument,
                    "Requested service, requested interface and candidate interface are required");
        final InterfaceSliver result = requestedIfs.copy();
        final Set<Integer> used = usedVlans(candidateIfs.getNodeId(), existingReservations);
        if (requestedNs.getLayer() == NetworkServiceLayer.L2)
            return allocateL2Vlan(result, mplsNs, candidateIfs, used);

        if (ownerSwitch == null)
            return AllocationResult.error(FailureKind.InvalidArgument, "Owner switch is required for " +
                    requestedNs.getType() + " interface " + requestedIfs.getName());
        final NetworkServiceSliver switchNs = findService(ownerSwitch, requestedNs.getType());
        if (switchNs == null)
            return AllocationResult.error(FailureKind.Failure, "Switch " + ownerSwitch.getName() +
                    " has no " + requestedNs.getType() + " service");
        final Delegation<Labels> delegation = Delegations.first(switchNs.getLabelDelegations());
        if (delegation == null || delegation.getPool() == null || delegation.getPool().getVlanRange() == null)
            return AllocationResult.error(FailureKind.Failure, "Service " + switchNs.getName() +
                    " on switch " + ownerSwitch.getName() + " has no delegated VLAN range");
        final VlanRange range;
        try {
            range = VlanRange.parse(delegation.getPool().getVlanRange());
        } catch (IllegalArgumentException e) {
            return AllocationResult.error(FailureKind.InvalidArgument, e.getMessage());
        }
        final Integer vlan = range.firstFree(used);
        if (vlan == null) {
            if (lenientVlanExhaustion) {
                logger.info("VLAN range " + range + " exhausted on interface " + candidateIfs.getName() +
                        ", leaving interface " + requestedIfs.getName() + " without a VLAN");
                return AllocationResult.success(result, delegation.getDelegationId());
            }
            return AllocationResult.error(new AllocationFailure(FailureKind.InsufficientResources,
                    "VLAN range " + range + " exhausted on interface " + candidateIfs.getName(),
                    Collections.singletonList("vlan")));
        }
        final String tag = String.valueOf(vlan);
        result.setLabels(AllocatedSlivers.labelsOrEmpty(result.getLabels()).toBuilder().withVlan(tag).build());
        result.setLabelAllocations(new Labels.Builder().withVlan(tag).build());
        logger.debug("Allocated VLAN " + tag + " to interface " + result.getName() + " on " + candidateIfs.getName());
        return AllocationResult.success(result, delegation.getDelegationId());
    }

    private AllocationResult<InterfaceSliver> allocateL2Vlan(InterfaceSliver result, NetworkServiceSliver mplsNs,
                                                             InterfaceSliver candidateIfs, Set<Integer> used) {
        final String requested = result.getLabels() == null ? null : result.getLabels().getVlan();
        if (requested == null)
            return AllocationResult.success(result);
        final int vlan;
        try {
            vlan = Integer.parseInt(requested.trim());
        } catch (NumberFormatException e) {
            return AllocationResult.error(FailureKind.InvalidArgument, "Invalid VLAN " + requested);
        }
        try {
            if (candidateIfs.getType() != InterfaceType.FacilityPort) {
                final VlanRange mplsRange = delegatedRange(mplsNs, defaultVlanRange);
                if (!mplsRange.contains(vlan))
                    return AllocationResult.error(FailureKind.Failure, "Vlan " + vlan +
                            " for L2 service is outside the allowed range " + mplsRange);
            }
            final VlanRange portRange = delegatedRange(candidateIfs, null);
            if (portRange != null && !portRange.contains(vlan))
                return AllocationResult.error(FailureKind.Failure, "Vlan " + vlan +
                        " for L2 service is outside the range " + portRange + " of interface " +
                        candidateIfs.getName());
            if (used.contains(vlan))
                return AllocationResult.error(FailureKind.Failure, "Vlan " + vlan +
                        " is already in use on interface " + candidateIfs.getName() +
                        (portRange == null ? "" : ", allowed range " + portRange));
        } catch (IllegalArgumentException e) {
            return AllocationResult.error(FailureKind.InvalidArgument, e.getMessage());
        }
        result.setLabelAllocations(AllocatedSlivers.labelsOrEmpty(result.getLabelAllocations()).toBuilder()
                .withVlan(String.valueOf(vlan)).build());
        return AllocationResult.success(result);
    }

    private static VlanRange delegatedRange(BaseSliver sliver, VlanRange defaultRange) {
        if (sliver == null)
            return defaultRange;
        final Delegation<Labels> delegation = Delegations.first(sliver.getLabelDelegations());
        if (delegation == null || delegation.getPool() == null || delegation.getPool().getVlanRange() == null)
            return defaultRange;
        return VlanRange.parse(delegation.getPool().getVlanRange());
    }

    private Set<Integer> usedVlans(String candidateIfsId, List<? extends ReservationRef> existingReservations) {
        final Set<Integer> used = new HashSet<>();
        if (existingReservations == null || candidateIfsId == null)
            return used;
        for (ReservationRef reservation : existingReservations) {
            final BaseSliver allocated = AllocatedSlivers.of(reservation);
            if (!(allocated instanceof NetworkServiceSliver))
                continue;
            for (InterfaceSliver ifs : ((NetworkServiceSliver) allocated).getInterfaces()) {
                if (ifs.getNodeMap() == null || !candidateIfsId.equals(ifs.getNodeMap().getNodeId()))
                    continue;
                final String vlan = ifs.getLabelAllocations() == null ? null : ifs.getLabelAllocations().getVlan();
                if (vlan == null)
                    continue;
                try {
                    used.add(Integer.parseInt(vlan.trim()));
                    logger.debug("Excluding VLAN " + vlan + " allocated to reservation " +
                            reservation.getReservationId() + " on interface " + candidateIfsId);
                } catch (NumberFormatException e) {
                    logger.warn("Ignoring invalid VLAN " + vlan + " of reservation " + reservation.getReservationId());
                }
            }
        }
        return used;
    }

    /**
     * Allocate a subnet and gateway to a routed network service, and an address in that subnet to each of its
     * interfaces. Services other than FABNetv4 and FABNetv6 are returned unchanged.
     * <P>
     * The subnet delegated to the switch's service of the same type is split into sub-blocks; the leading
     * reserved sub-blocks and those held by other reservations are skipped and the first remaining one is used.
     * The first host of that sub-block becomes the gateway and interfaces get the following hosts in order.
     *
     * @param rid identifier of the reservation being allocated, ignored among the existing reservations
     * @param requestedNs the requested network service
     * @param ownerSwitch the substrate switch serving the service
     * @param existingReservations reservations already served by the switch
     * @return a copy of the requested service with gateway and addresses allocated, or the reason it could not be
     */
    public AllocationResult<NetworkServiceSliver> allocate(String rid, NetworkServiceSliver requestedNs,
                                                           NodeSliver ownerSwitch,
                                                           List<? extends ReservationRef> existingReservations) {
        if (requestedNs == null)
            return AllocationResult.error(FailureKind.InvalidArgument, "Requested service is required");
        final NetworkServiceSliver result = requestedNs.copy();
        if (requestedNs.getType() == null || !requestedNs.getType().isRouted())
            return AllocationResult.success(result);
        if (ownerSwitch == null)
            return AllocationResult.error(FailureKind.InvalidArgument, "Owner switch is required for " +
                    requestedNs.getType() + " service " + requestedNs.getName());

        final NetworkServiceSliver switchNs = findService(ownerSwitch, requestedNs.getType());
        if (switchNs == null)
            return AllocationResult.error(FailureKind.Failure, "Switch " + ownerSwitch.getName() +
                    " has no " + requestedNs.getType() + " service");
        final boolean ipv6 = requestedNs.getType() == ServiceType.FABNetv6;
        final Delegation<Labels> delegation = Delegations.first(switchNs.getLabelDelegations());
        final String delegatedSubnet = delegation == null || delegation.getPool() == null ? null :
                (ipv6 ? delegation.getPool().getIpv6Subnet() : delegation.getPool().getIpv4Subnet());
        if (delegatedSubnet == null)
            return AllocationResult.error(FailureKind.InvalidArgument, "Service " + switchNs.getName() +
                    " on switch " + ownerSwitch.getName() + " has no delegated subnet");

        final IpSubnet parent;
        final int newPrefix = ipv6 ? ipv6SubnetPrefix : ipv4SubnetPrefix;
        final BigInteger count;
        try {
            parent = IpSubnet.parse(delegatedSubnet);
            if (parent.isIpv6() != ipv6)
                return AllocationResult.error(FailureKind.InvalidArgument, "Delegated subnet " + delegatedSubnet +
                        " does not match service type " + requestedNs.getType());
            count = parent.subnetCount(newPrefix);
        } catch (IllegalArgumentException e) {
            return AllocationResult.error(FailureKind.InvalidArgument, e.getMessage());
        }

        final Set<BigInteger> taken = new HashSet<>();
        if (existingReservations != null) {
            for (ReservationRef reservation : existingReservations) {
                if (reservation.getReservationId().equals(rid))
                    continue;
                final BaseSliver allocated = AllocatedSlivers.of(reservation);
                if (!(allocated instanceof NetworkServiceSliver))
                    continue;
                final NetworkServiceSliver allocatedNs = (NetworkServiceSliver) allocated;
                if (allocatedNs.getType() != requestedNs.getType() || allocatedNs.getGateway() == null ||
                        allocatedNs.getGateway().getSubnet() == null)
                    continue;
                final String subnet = allocatedNs.getGateway().getSubnet();
                final BigInteger index;
                try {
                    final IpSubnet s = IpSubnet.parse(subnet);
                    index = s.getPrefixLength() == newPrefix ? parent.indexOf(s) : BigInteger.ONE.negate();
                } catch (IllegalArgumentException e) {
                    return AllocationResult.error(FailureKind.Failure, "Reservation " +
                            reservation.getReservationId() + " holds an invalid subnet " + subnet);
                }
                if (index.compareTo(BigInteger.valueOf(reservedSubnets)) < 0)
                    return AllocationResult.error(FailureKind.Failure, "Subnet " + subnet + " of reservation " +
                            reservation.getReservationId() + " is not an allocatable /" + newPrefix +
                            " sub-block of " + parent);
                taken.add(index);
                logger.debug("Excluding subnet " + subnet + " allocated to reservation " +
                        reservation.getReservationId());
            }
        }

        IpSubnet chosen = null;
        for (BigInteger i = BigInteger.valueOf(reservedSubnets); i.compareTo(count) < 0; i = i.add(BigInteger.ONE)) {
            if (!taken.contains(i)) {
                chosen = parent.subnet(i, newPrefix);
                break;
            }
        }
        if (chosen == null) {
            logger.info("No free /" + newPrefix + " sub-block left in " + parent + " for " + requestedNs.getName());
            return AllocationResult.error(new AllocationFailure(FailureKind.InsufficientResources,
                    "No free /" + newPrefix + " sub-block left in " + parent,
                    Collections.singletonList(ipv6 ? "ipv6_subnet" : "ipv4_subnet")));
        }

        final List<InterfaceSliver> interfaces = result.getInterfaces();
        if (BigInteger.valueOf(interfaces.size() + 1L).compareTo(chosen.lastHostOffset()) > 0)
            return AllocationResult.error(new AllocationFailure(FailureKind.InsufficientResources,
                    "Sub-block " + chosen + " cannot address " + interfaces.size() + " interfaces",
                    Collections.singletonList(ipv6 ? "ipv6" : "ipv4")));

        final Labels.Builder gateway = new Labels.Builder();
        if (ipv6)
            gateway.withIpv6Subnet(chosen.toString()).withIpv6(chosen.host(1));
        else
            gateway.withIpv4Subnet(chosen.toString()).withIpv4(chosen.host(1));
        result.setGateway(new Gateway(gateway.build()));

        long offset = 2;
        for (InterfaceSliver ifs : interfaces) {
            final String address = chosen.host(offset++);
            final Labels.Builder labels = AllocatedSlivers.labelsOrEmpty(ifs.getLabels()).toBuilder();
            final Labels.Builder allocations = AllocatedSlivers.labelsOrEmpty(ifs.getLabelAllocations()).toBuilder();
            if (ipv6) {
                labels.withIpv6(address);
                allocations.withIpv6(address);
            } else {
                labels.withIpv4(address);
                allocations.withIpv4(address);
            }
            ifs.setLabels(labels.build());
            ifs.setLabelAllocations(allocations.build());
        }
        logger.debug("Allocated subnet " + chosen + " to service " + result.getName() + " of reservation " + rid);
        return AllocationResult.success(result, delegation.getDelegationId());
    }

    private static NetworkServiceSliver findService(NodeSliver ownerSwitch, ServiceType type) {
        for (NetworkServiceSliver ns : ownerSwitch.getNetworkServices()) {
            if (ns.getType() == type)
                return ns;
        }
        return null;
    }
}
