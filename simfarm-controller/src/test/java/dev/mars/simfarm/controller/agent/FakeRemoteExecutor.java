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

import dev.mars.simfarm.controller.exec.CommandResult;
import dev.mars.simfarm.controller.exec.RemoteExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records every remote command and transfer. Replies to commands are scripted by
 * prefix; downloads write a small file locally.
 */
class FakeRemoteExecutor implements RemoteExecutor {

    private final List<String> commands = new ArrayList<>();
    private final List<String> uploads = new ArrayList<>();
    private final List<String> downloads = new ArrayList<>();
    private final Map<String, Deque<CommandResult>> replies = new HashMap<>();
    private final Set<String> missingRemoteFiles = new HashSet<>();
    private boolean unreachable;

    FakeRemoteExecutor reply(String commandPrefix, CommandResult... results) {
        replies.computeIfAbsent(commandPrefix, key -> new ArrayDeque<>()).addAll(List.of(results));
        return this;
    }

    FakeRemoteExecutor missing(String remotePath) {
        missingRemoteFiles.add(remotePath);
        return this;
    }

    FakeRemoteExecutor unreachable() {
        this.unreachable = true;
        return this;
    }

    @Override
    public CommandResult run(String address, String command) throws IOException {
        if (unreachable) {
            throw new IOException("ssh: connect to host " + address + " port 22: Connection refused");
        }
        commands.add(command);
        for (Map.Entry<String, Deque<CommandResult>> entry : replies.entrySet()) {
            if (command.startsWith(entry.getKey())) {
                Deque<CommandResult> queue = entry.getValue();
                return queue.size() > 1 ? queue.poll() : queue.peek();
            }
        }
        return new CommandResult(0, "");
    }

    @Override
    public void upload(String address, Path local, String remote) {
        uploads.add(local.getFileName() + " -> " + remote);
    }

    @Override
    public void download(String address, String remote, Path local) throws IOException {
        if (missingRemoteFiles.contains(remote)) {
            throw new IOException("scp: " + remote + ": No such file or directory");
        }
        downloads.add(remote);
        Files.createDirectories(local.getParent());
        Files.writeString(local, "contents of " + remote);
    }

    List<String> getCommands() {
        return commands;
    }

    List<String> getUploads() {
        return uploads;
    }

    List<String> getDownloads() {
        return downloads;
    }

    static CommandResult screenList(String... sessions) {
        if (sessions.length == 0) {
            return new CommandResult(1, "No Sockets found in /run/screen/S-centos.\n");
        }
        StringBuilder out = new StringBuilder("There are screens on:\n");
        int pid = 4000;
        for (String session : sessions) {
            out.append('\t').append(pid++).append('.').append(session).append("\t(Detached)\n");
        }
        out.append(sessions.length).append(" Sockets in /run/screen/S-centos.\n");
        return new CommandResult(0, out.toString());
    }
}
