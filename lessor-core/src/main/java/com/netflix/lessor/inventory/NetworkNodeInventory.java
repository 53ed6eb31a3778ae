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
import com.netflix.lessor.slivers.Capacities;
import com.netflix.lessor.slivers.ComponentSliver;
import com.netflix.lessor.slivers.ComponentType;
import com.netflix.lessor.slivers.Delegation;
import com.netflix.lessor.slivers.Delegations;
import com.netflix.lessor.slivers.InterfaceSliver;
import com.netflix.lessor.slivers.Labels;
import com.netflix.lessor.slivers.NetworkServiceLayer;
import com.netflix.lessor.slivers.NetworkServiceSliver;
import com.netflix.lessor.slivers.NodeMap;
import com.netflix.lessor.slivers.NodeSliver;
import com.netflix.lessor.slivers.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Matches a requested VM or switch against a candidate substrate node. The node's delegated capacity must cover
 * the request after subtracting what other reservations hold on it, and every requested component must be bound
 * to a free substrate component of its type: whole devices for dedicated components and smart NICs, a single PCI
 * address for shared NICs.
 * <P>
 * Candidates are scanned in the order the substrate node lists them and the first eligible one is taken, so
 * callers that need repeatable results must list candidates in a stable order.
 * <P>
 * Allocation never modifies its arguments: the result is an annotated copy of the requested sliver. Instances are
 * stateless between calls and may be shared.
 */
public class NetworkNodeInventory {

    /**
     * The builder for {@link NetworkNodeInventory}.
     */
    public final static class Builder {
        private Logger logger = LoggerFactory.getLogger(NetworkNodeInventory.class);

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

        public NetworkNodeInventory build() {
            return new NetworkNodeInventory(logger);
        }
    }

    // A substrate component with what is still free on it for the current attempt.
    private static class ComponentCandidate {
        private final ComponentSliver component;
        private final Labels pool;
        private final List<String> freeBdfs;
        private boolean bound = false;

        private ComponentCandidate(ComponentSliver component) {
            this.component = component;
            this.pool = AllocatedSlivers.poolLabels(component);
            this.freeBdfs = new ArrayList<>(pool.getBdfs());
        }

        private boolean isShared() {
            return component.getType() == ComponentType.SharedNIC;
        }

        private boolean isAvailable() {
            return isShared() ? !freeBdfs.isEmpty() : !bound;
        }
    }

    private final Logger logger;

    private NetworkNodeInventory(Logger logger) {
        this.logger = logger;
    }

    /**
     * Allocate a requested node on a candidate substrate node.
     *
     * @param rid identifier of the reservation being allocated, ignored among the existing reservations
     * @param requested the requested sliver, a VM or a switch
     * @param graphId identifier of the delegation graph the candidate belongs to
     * @param candidate the candidate substrate node
     * @param existingReservations reservations holding resources on the candidate node
     * @param existingComponents PCI addresses already used by other network services, keyed by substrate
     *                           component id
     * @param operation the reservation operation being performed
     * @return a copy of the requested node annotated with its allocation, with the id of the capacity delegation
     * used, or the reason the candidate does not fit
     */
    public AllocationResult<NodeSliver> allocate(String rid, BaseSliver requested, String graphId,
                                                 BaseSliver candidate,
                                                 List<? extends ReservationRef> existingReservations,
                                                 Map<String, List<String>> existingComponents,
                                                 ReservationOperation operation) {
        if (!(requested instanceof NodeSliver) || !(candidate instanceof NodeSliver))
            return AllocationResult.error(FailureKind.InvalidArgument,
                    "Requested and candidate slivers must be nodes, got " + kind(requested) + " and " +
                            kind(candidate));
        final NodeSliver request = (NodeSliver) requested;
        final NodeSliver node = (NodeSliver) candidate;
        if (!isSupported(request.getType(), node.getType()))
            return AllocationResult.error(FailureKind.InvalidArgument, "Unsupported request of type " +
                    request.getType() + " on candidate of type " + node.getType());
        final ReservationOperation op = operation == null ? ReservationOperation.Create : operation;
        final List<? extends ReservationRef> existing = existingReservations == null ?
                Collections.<ReservationRef>emptyList() : existingReservations;

        final NodeSliver result = request.copy();
        final Delegation<Capacities> delegation = Delegations.first(node.getCapacityDelegations());
        if (delegation == null || delegation.getPool() == null)
            return AllocationResult.error(FailureKind.InvalidArgument, "Candidate " + node.getName() +
                    " has no capacity delegation");
        final Capacities requestedCapacities = result.getCapacities() == null ? Capacities.EMPTY :
                result.getCapacities();
        final AllocationFailure capacityFailure = checkCapacities(rid, node, delegation.getPool(),
                requestedCapacities, existing);
        if (capacityFailure != null) {
            logger.info("Reservation " + rid + " does not fit on " + node.getName() + ": " +
                    capacityFailure.getMessage());
            return AllocationResult.error(capacityFailure);
        }

        if (request.getType() == NodeType.Switch) {
            result.setNodeMap(new NodeMap(graphId, node.getNodeId()));
            result.setCapacityAllocations(requestedCapacities);
            if (op == ReservationOperation.Create) {
                final String localName = AllocatedSlivers.poolLabels(node).getLocalName();
                result.setLabelAllocations(new Labels.Builder()
                        .withLocalName(localName == null ? node.getName() : localName).build());
            }
            result.setManagementIp(node.getManagementIp());
            return AllocationResult.success(result, delegation.getDelegationId());
        }

        if (!result.getComponents().isEmpty()) {
            final AllocationFailure componentFailure = allocateComponents(rid, result, graphId, node, existing,
                    existingComponents, op);
            if (componentFailure != null) {
                logger.info("Components of reservation " + rid + " do not fit on " + node.getName() + ": " +
                        componentFailure.getMessage());
                return AllocationResult.error(componentFailure);
            }
        }

        result.setNodeMap(new NodeMap(graphId, node.getNodeId()));
        result.setCapacityAllocations(requestedCapacities);
        if (op == ReservationOperation.Create)
            result.setLabelAllocations(new Labels.Builder().withInstanceParent(node.getName()).build());
        return AllocationResult.success(result, delegation.getDelegationId());
    }

    private static String kind(BaseSliver sliver) {
        return sliver == null ? "null" : sliver.getKind().toString();
    }

    private static boolean isSupported(NodeType requested, NodeType candidate) {
        if (requested == NodeType.VM)
            return candidate == NodeType.Server || candidate == NodeType.VM;
        if (requested == NodeType.Switch)
            return candidate == NodeType.Switch;
        return false;
    }

    private AllocationFailure checkCapacities(String rid, NodeSliver node, Capacities delegated, Capacities requested,
                                              List<? extends ReservationRef> existing) {
        Capacities available = delegated;
        for (ReservationRef reservation : existing) {
            if (reservation.getReservationId().equals(rid))
                continue;
            final BaseSliver allocated = AllocatedSlivers.of(reservation);
            if (!(allocated instanceof NodeSliver) || !onNode(allocated, node))
                continue;
            if (allocated.getCapacityAllocations() == null)
                continue;
            logger.debug("Excluding " + allocated.getCapacityAllocations() + " held by reservation " +
                    reservation.getReservationId() + " on " + node.getName());
            available = available.minus(allocated.getCapacityAllocations());
        }
        final List<String> shortOf = available.minus(requested).negativeFields();
        if (shortOf.isEmpty())
            return null;
        return new AllocationFailure(FailureKind.InsufficientResources, "Insufficient resources " + shortOf +
                ": requested " + requested + ", available " + available, shortOf);
    }

    private static boolean onNode(BaseSliver allocated, NodeSliver node) {
        return allocated.getNodeMap() == null || node.getNodeId() == null ||
                node.getNodeId().equals(allocated.getNodeMap().getNodeId());
    }

    private AllocationFailure allocateComponents(String rid, NodeSliver result, String graphId, NodeSliver node,
                                                 List<? extends ReservationRef> existing,
                                                 Map<String, List<String>> existingComponents,
                                                 ReservationOperation op) {
        final List<ComponentCandidate> candidates = new ArrayList<>();
        for (ComponentSliver component : node.getComponents())
            candidates.add(new ComponentCandidate(component));
        excludeReserved(rid, node, candidates, existing);
        excludeInUse(candidates, existingComponents);
        if (op == ReservationOperation.Modify) {
            for (ComponentSliver requested : result.getComponents())
                keepBinding(requested, candidates);
        }

        for (ComponentSliver requested : result.getComponents()) {
            if (op == ReservationOperation.Extend) {
                final AllocationFailure failure = checkStillAvailable(requested, candidates);
                if (failure != null)
                    return failure;
                continue;
            }
            if (op == ReservationOperation.Modify && requested.getNodeMap() != null)
                continue;
            final ComponentCandidate candidate = findCandidate(requested, candidates);
            if (candidate == null)
                return new AllocationFailure(FailureKind.InsufficientResources, "No " + requested.getType() +
                        (requested.getModel() == null ? "" : " of model " + requested.getModel()) +
                        " available on " + node.getName() + " for component " + requested.getName(),
                        Collections.singletonList(requested.getName()));
            final AllocationFailure failure;
            switch (requested.getType()) {
                case SharedNIC:
                    failure = bindSharedNic(requested, candidate, graphId);
                    break;
                case SmartNIC:
                    failure = bindSmartNic(requested, candidate, graphId);
                    break;
                case Storage:
                    requested.setCapacityAllocations(Capacities.ofUnits(1));
                    requested.setLabelAllocations(requested.getLabels());
                    requested.setNodeMap(new NodeMap(graphId, candidate.component.getNodeId()));
                    failure = null;
                    break;
                default:
                    bindWhole(requested, candidate, graphId);
                    failure = null;
                    break;
            }
            if (failure != null)
                return failure;
        }
        return null;
    }

    private void excludeReserved(String rid, NodeSliver node, List<ComponentCandidate> candidates,
                                 List<? extends ReservationRef> existing) {
        for (ReservationRef reservation : existing) {
            if (reservation.getReservationId().equals(rid))
                continue;
            final BaseSliver allocated = AllocatedSlivers.of(reservation);
            if (!(allocated instanceof NodeSliver) || !onNode(allocated, node))
                continue;
            for (ComponentSliver component : ((NodeSliver) allocated).getComponents()) {
                if (component.getNodeMap() == null)
                    continue;
                final ComponentCandidate candidate = find(candidates, component.getNodeMap().getNodeId());
                if (candidate == null)
                    continue;
                if (candidate.isShared()) {
                    final List<String> bdfs = component.getLabelAllocations() == null ?
                            Collections.<String>emptyList() : component.getLabelAllocations().getBdfs();
                    candidate.freeBdfs.removeAll(bdfs);
                    logger.debug("Excluding PCI addresses " + bdfs + " of " + candidate.component.getName() +
                            " held by reservation " + reservation.getReservationId());
                } else if (candidate.component.getType() != ComponentType.Storage) {
                    candidate.bound = true;
                    logger.debug("Excluding component " + candidate.component.getName() +
                            " held by reservation " + reservation.getReservationId());
                }
            }
        }
    }

    private void excludeInUse(List<ComponentCandidate> candidates, Map<String, List<String>> existingComponents) {
        if (existingComponents == null)
            return;
        for (Map.Entry<String, List<String>> entry : existingComponents.entrySet()) {
            final ComponentCandidate candidate = find(candidates, entry.getKey());
            if (candidate == null)
                continue;
            if (candidate.isShared()) {
                if (entry.getValue() != null)
                    candidate.freeBdfs.removeAll(entry.getValue());
            } else if (candidate.component.getType() != ComponentType.Storage) {
                candidate.bound = true;
            }
            logger.debug("Excluding " + entry.getValue() + " of " + candidate.component.getName() +
                    " used by other network services");
        }
    }

    private static ComponentCandidate find(List<ComponentCandidate> candidates, String componentId) {
        if (componentId == null)
            return null;
        for (ComponentCandidate candidate : candidates) {
            if (componentId.equals(candidate.component.getNodeId()))
                return candidate;
        }
        return null;
    }

    private static ComponentCandidate findCandidate(ComponentSliver requested, List<ComponentCandidate> candidates) {
        for (ComponentCandidate candidate : candidates) {
            if (candidate.component.getType() != requested.getType())
                continue;
            if (requested.getModel() != null && !requested.getModel().equals(candidate.component.getModel()))
                continue;
            if (candidate.isAvailable())
                return candidate;
        }
        return null;
    }

    private static AllocationFailure checkStillAvailable(ComponentSliver requested,
                                                         List<ComponentCandidate> candidates) {
        if (requested.getNodeMap() == null || requested.getType() == ComponentType.Storage)
            return null;
        final ComponentCandidate candidate = find(candidates, requested.getNodeMap().getNodeId());
        if (candidate == null)
            return new AllocationFailure(FailureKind.InsufficientResources, "Component " + requested.getName() +
                    " is bound to " + requested.getNodeMap().getNodeId() + " which the candidate does not offer",
                    Collections.singletonList(requested.getName()));
        if (candidate.isShared()) {
            final String bdf = requested.getLabelAllocations() == null ? null :
                    requested.getLabelAllocations().getBdf();
            if (bdf != null && !candidate.freeBdfs.contains(bdf))
                return new AllocationFailure(FailureKind.InsufficientResources, "PCI address " + bdf + " of " +
                        candidate.component.getName() + " is in use by another reservation",
                        Collections.singletonList(requested.getName()));
            candidate.freeBdfs.remove(bdf);
            return null;
        }
        if (candidate.bound)
            return new AllocationFailure(FailureKind.InsufficientResources, "Component " +
                    candidate.component.getName() + " is in use by another reservation",
                    Collections.singletonList(requested.getName()));
        candidate.bound = true;
        return null;
    }

    // a component already bound by this reservation stays bound, so it is not offered to its new components
    private static void keepBinding(ComponentSliver requested, List<ComponentCandidate> candidates) {
        if (requested.getNodeMap() == null)
            return;
        final ComponentCandidate candidate = find(candidates, requested.getNodeMap().getNodeId());
        if (candidate == null)
            return;
        if (candidate.isShared()) {
            if (requested.getLabelAllocations() != null)
                candidate.freeBdfs.removeAll(requested.getLabelAllocations().getBdfs());
        } else if (candidate.component.getType() != ComponentType.Storage) {
            candidate.bound = true;
        }
    }

    private void bindWhole(ComponentSliver requested, ComponentCandidate candidate, String graphId) {
        candidate.bound = true;
        requested.setNodeMap(new NodeMap(graphId, candidate.component.getNodeId()));
        requested.setLabelAllocations(candidate.pool);
        requested.setCapacityAllocations(AllocatedSlivers.poolCapacities(candidate.component));
        logger.debug("Bound component " + requested.getName() + " to " + candidate.component.getName());
    }

    private AllocationFailure bindSmartNic(ComponentSliver requested, ComponentCandidate candidate, String graphId) {
        final List<NetworkServiceSliver> requestedServices = requested.getNetworkServices();
        final List<NetworkServiceSliver> candidateServices = candidate.component.getNetworkServices();
        if (requestedServices.isEmpty() || candidateServices.isEmpty())
            return new AllocationFailure(FailureKind.Failure, "Smart NIC " + requested.getName() + " or " +
                    candidate.component.getName() + " has no network service");
        bindWhole(requested, candidate, graphId);
        final NetworkServiceSliver requestedNs = requestedServices.get(0);
        final List<InterfaceSliver> requestedIfs = requestedNs.getInterfaces();
        final List<InterfaceSliver> candidateIfs = candidateServices.get(0).getInterfaces();
        for (int i = 0; i < requestedIfs.size() && i < candidateIfs.size(); i++) {
            final InterfaceSliver ifs = requestedIfs.get(i);
            final Labels port = AllocatedSlivers.poolLabels(candidateIfs.get(i));
            final Labels asked = AllocatedSlivers.labelsOrEmpty(ifs.getLabels());
            final Labels.Builder allocation = new Labels.Builder()
                    .withBdf(port.getBdf())
                    .withMac(port.getMac())
                    .withLocalName(port.getLocalName());
            if (requestedNs.getLayer() == NetworkServiceLayer.L2)
                allocation.withVlan(asked.getVlan()).withIpv4(asked.getIpv4()).withIpv6(asked.getIpv6());
            final Labels labels = allocation.build();
            ifs.setLabelAllocations(labels);
            ifs.setLabels(asked.toBuilder().withBdf(port.getBdf()).withMac(port.getMac())
                    .withLocalName(port.getLocalName()).build());
            ifs.setNodeMap(new NodeMap(graphId, candidateIfs.get(i).getNodeId()));
        }
        return null;
    }

    private AllocationFailure bindSharedNic(ComponentSliver requested, ComponentCandidate candidate,
                                            String graphId) {
        final List<NetworkServiceSliver> candidateServices = candidate.component.getNetworkServices();
        if (candidateServices.size() != 1 || candidateServices.get(0).getInterfaces().size() != 1)
            return new AllocationFailure(FailureKind.Failure, "Shared NIC " + candidate.component.getName() +
                    " must expose exactly one network service with one interface");
        final InterfaceSliver candidateIfs = candidateServices.get(0).getInterfaces().get(0);
        final Labels port = AllocatedSlivers.poolLabels(candidateIfs);
        final List<String> allBdfs = candidate.pool.getBdfs();

        final NetworkServiceSliver requestedNs = requested.getNetworkServices().isEmpty() ? null :
                requested.getNetworkServices().get(0);
        final InterfaceSliver requestedIfs = requestedNs == null || requestedNs.getInterfaces().isEmpty() ? null :
                requestedNs.getInterfaces().get(0);
        final Labels asked = requestedIfs == null ? Labels.EMPTY :
                AllocatedSlivers.labelsOrEmpty(requestedIfs.getLabels());

        String bdf = null;
        if (asked.getVlan() != null) {
            for (String free : candidate.freeBdfs) {
                if (asked.getVlan().equals(at(port.getVlans(), allBdfs.indexOf(free)))) {
                    bdf = free;
                    break;
                }
            }
        }
        if (bdf == null)
            bdf = candidate.freeBdfs.get(0);
        candidate.freeBdfs.remove(bdf);
        final int index = allBdfs.indexOf(bdf);

        requested.setNodeMap(new NodeMap(graphId, candidate.component.getNodeId()));
        requested.setCapacityAllocations(Capacities.ofUnits(1));
        requested.setLabelAllocations(new Labels.Builder().withBdf(bdf).withNuma(at(candidate.pool.getNumas(), index))
                .build());
        logger.debug("Bound shared NIC " + requested.getName() + " to PCI address " + bdf + " of " +
                candidate.component.getName());

        if (requestedIfs != null) {
            final Labels.Builder allocation = new Labels.Builder()
                    .withBdf(bdf)
                    .withMac(at(port.getMacs(), index))
                    .withLocalName(at(port.getLocalNames(), index));
            final String model = candidate.component.getModel();
            if (model == null || !model.contains("OpenStack"))
                allocation.withVlan(at(port.getVlans(), index));
            if (requestedNs.getLayer() == NetworkServiceLayer.L2)
                allocation.withIpv4(asked.getIpv4()).withIpv6(asked.getIpv6());
            final Labels labels = allocation.build();
            requestedIfs.setLabelAllocations(labels);
            requestedIfs.setLabels(labels);
            requestedIfs.setNodeMap(new NodeMap(graphId, candidateIfs.getNodeId()));
        }
        return null;
    }

    private static String at(List<String> values, int index) {
        return index >= 0 && index < values.size() ? values.get(index) : null;
    }
}
