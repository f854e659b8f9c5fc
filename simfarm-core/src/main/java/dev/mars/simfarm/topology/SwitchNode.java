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

import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.inventory.HostSlot;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A simulated switch. Downlink {@code i} is attached to port {@code i}; the uplink,
 * if any, uses port {@code getDownlinks().size()}.
 */
public final class SwitchNode extends TopologyNode {

    private final List<TopologyNode> downlinks = new ArrayList<>();

    private Integer linkLatency;
    private Integer switchingLatency;
    private Integer bandwidth;

    private ForwardingTable forwardingTable;
    private HostSlot host;
    private Path builtBinary;

    public SwitchNode() {
    }

    /**
     * Attaches {@code child} below this switch on the next free downlink port.
     *
     * @throws TopologyShapeException if the child already has an uplink (multi-path
     *                                topologies are not supported) or would form a loop
     */
    public SwitchNode addDownlink(TopologyNode child) throws TopologyShapeException {
        if (child == this) {
            throw new TopologyShapeException(getId(), "a switch cannot be its own downlink");
        }
        if (child.hasUplink()) {
            throw new TopologyShapeException(child.getId(),
                    "node already has an uplink; multiple uplinks are not supported");
        }
        for (SwitchNode ancestor = this; ancestor != null; ancestor = ancestor.getUplink()) {
            if (ancestor == child) {
                throw new TopologyShapeException(child.getId(), "attaching this downlink would create a loop");
            }
        }
        child.attachUplink(this);
        downlinks.add(child);
        return this;
    }

    public SwitchNode addDownlinks(TopologyNode... children) throws TopologyShapeException {
        for (TopologyNode child : children) {
            addDownlink(child);
        }
        return this;
    }

    public List<TopologyNode> getDownlinks() {
        return Collections.unmodifiableList(downlinks);
    }

    public int getUplinkPort() {
        return downlinks.size();
    }

    public Integer getLinkLatency() {
        return linkLatency;
    }

    public SwitchNode setLinkLatency(Integer linkLatency) {
        this.linkLatency = linkLatency;
        return this;
    }

    public Integer getSwitchingLatency() {
        return switchingLatency;
    }

    public SwitchNode setSwitchingLatency(Integer switchingLatency) {
        this.switchingLatency = switchingLatency;
        return this;
    }

    public Integer getBandwidth() {
        return bandwidth;
    }

    public SwitchNode setBandwidth(Integer bandwidth) {
        this.bandwidth = bandwidth;
        return this;
    }

    public ForwardingTable getForwardingTable() {
        return forwardingTable;
    }

    public void setForwardingTable(ForwardingTable forwardingTable) {
        this.forwardingTable = forwardingTable;
    }

    @Override
    public HostSlot getHost() {
        return host;
    }

    public void assignHost(HostSlot host) {
        this.host = host;
    }

    public Path getBuiltBinary() {
        return builtBinary;
    }

    public void setBuiltBinary(Path builtBinary) {
        this.builtBinary = builtBinary;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSwitch(this);
    }

    @Override
    public String describe() {
        return getId() + " | ports: " + (downlinks.size() + (hasUplink() ? 1 : 0))
                + " | latency: " + linkLatency + " | bw: " + bandwidth;
    }
}
