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

package dev.mars.simfarm.controller.exec;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs commands on, and copies files to and from, a fleet host.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public interface RemoteExecutor {

    /**
     * Runs a shell command on the host. A non-zero exit is reported in the result,
     * not thrown.
     *
     * @throws IOException if the host cannot be reached at all
     */
    CommandResult run(String address, String command) throws IOException, InterruptedException;

    void upload(String address, Path local, String remote) throws IOException, InterruptedException;

    void download(String address, String remote, Path local) throws IOException, InterruptedException;
}
