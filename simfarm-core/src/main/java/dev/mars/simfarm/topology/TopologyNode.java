/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.simfarm.topology;

import dev.mars.simfarm.inventory.HostSlot;

import java.util.Collection;
import java.util.List;

/**
 * A node of the simulated network tree.
 *
 * <p>The hierarchy is closed: a node is a {@link SwitchNode} or an
 * {@link EndpointNode} ({@link MachineNode} or {@link GroupPlaceholder}). Code that
 * must treat every variant explicitly goes through {@link Visitor}, so a new variant
 * cannot be added without every pass stating how it handles it.</p>
 *
 * <p>Nodes are owned by their {@link TopologyGraph}; uplink references are
 * non-owning back pointers. Ids are assigned by the graph in DFS order.</p>
 */
public abstract sealed class TopologyNode permits SwitchNode, EndpointNode {

    private String id;
    private SwitchNode uplink;
    private List<MacAddress> downlinkAddresses = List.of();

    protected TopologyNode() {
    }

    public String getId() {
        return id != null ? id : "<unnamed " + getClass().getSimpleName() + ">";
    }

    void assignId(String id) {
        this.id = id;
    }

    public SwitchNode getUplink() {
        return uplink;
    }

    void attachUplink(SwitchNode uplink) {
        this.uplink = uplink;
    }

    public boolean hasUplink() {
        return uplink != null;
    }

    /**
     * Addresses reachable at or below this node. Empty until forwarding tables are computed.
     */
    public List<MacAddress> getDownlinkAddresses() {
        return downlinkAddresses;
    }

    public void setDownlinkAddresses(Collection<MacAddress> addresses) {
        this.downlinkAddresses = List.copyOf(addresses);
    }

    /**
     * @return the host this node runs on, or {@code null} before host mapping
     */
    public abstract HostSlot getHost();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Short multi-field label used in diagrams and status output.
     */
    public abstract String describe();

    @Override
    public String toString() {
        return getId();
    }

    /**
     * Exhaustive handling of the node variants.
     *
     * @param <R> result type
     */
    public interface Visitor<R> {

        R visitSwitch(SwitchNode node);

        R visitMachine(MachineNode node);

        R visitPlaceholder(GroupPlaceholder node);
    }
}
