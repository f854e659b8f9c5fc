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

package dev.mars.simfarm.controller.agent;

import dev.mars.simfarm.core.exceptions.HostUnreachableException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.inventory.HostSlot;

/**
 * Performs the fleet operations on one host. Every operation works only on what the
 * plan placed on that host, and the kill operations are safe to repeat.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public interface HostAgent {

    HostSlot getHost();

    void checkLiveness() throws HostUnreachableException;

    /**
     * Installs drivers, images and switch binaries and prepares the accelerators.
     */
    void infrasetup() throws SimFarmException;

    void startSwitches() throws SimFarmException;

    void startSimulations() throws SimFarmException;

    void killSwitches() throws SimFarmException;

    /**
     * @param releaseBlockDevices also disconnect the host's network block devices;
     *                            false keeps them for copying results afterwards
     */
    void killSimulations(boolean releaseBlockDevices) throws SimFarmException;

    /**
     * Returns once no switch or simulation session is left on the host.
     */
    void confirmExit() throws SimFarmException;

    HostStatus monitorJobs(MonitorRequest request) throws SimFarmException;
}
