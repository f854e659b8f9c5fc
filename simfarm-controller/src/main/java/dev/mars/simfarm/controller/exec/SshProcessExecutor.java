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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteExecutor} that shells out to the system {@code ssh} and {@code scp}
 * binaries in batch mode, so key-based authentication must already be set up.
 */
public class SshProcessExecutor implements RemoteExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SshProcessExecutor.class);

    /** ssh exits with 255 when the connection itself fails. */
    private static final int SSH_CONNECTION_FAILURE = 255;

    private final String user;
    private final Duration timeout;
    private final String sshBinary;
    private final String scpBinary;

    public SshProcessExecutor(String user, Duration timeout) {
        this(user, timeout, "ssh", "scp");
    }

    SshProcessExecutor(String user, Duration timeout, String sshBinary, String scpBinary) {
        this.user = Objects.requireNonNull(user, "SSH user cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
        this.sshBinary = Objects.requireNonNull(sshBinary, "ssh binary cannot be null");
        this.scpBinary = Objects.requireNonNull(scpBinary, "scp binary cannot be null");
    }

    @Override
    public CommandResult run(String address, String command) throws IOException, InterruptedException {
        List<String> argv = new ArrayList<>(sshOptions(sshBinary));
        argv.add(user + "@" + address);
        argv.add(command);
        CommandResult result = execute(argv);
        if (result.exitCode() == SSH_CONNECTION_FAILURE) {
            throw new IOException("ssh to " + address + " failed: " + result.output().trim());
        }
        logger.debug("[{}] {} -> exit {}", address, command, result.exitCode());
        return result;
    }

    @Override
    public void upload(String address, Path local, String remote) throws IOException, InterruptedException {
        List<String> argv = new ArrayList<>(sshOptions(scpBinary));
        argv.add("-r");
        argv.add(local.toString());
        argv.add(user + "@" + address + ":" + remote);
        requireSuccess(execute(argv), "upload " + local + " to " + address + ":" + remote);
    }

    @Override
    public void download(String address, String remote, Path local) throws IOException, InterruptedException {
        Path parent = local.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        List<String> argv = new ArrayList<>(sshOptions(scpBinary));
        argv.add("-r");
        argv.add(user + "@" + address + ":" + remote);
        argv.add(local.toString());
        requireSuccess(execute(argv), "download " + address + ":" + remote + " to " + local);
    }

    private List<String> sshOptions(String binary) {
        return List.of(binary,
                "-o", "BatchMode=yes",
                "-o", "StrictHostKeyChecking=no",
                "-o", "ConnectTimeout=" + Math.max(1, timeout.toSeconds()));
    }

    private CommandResult execute(List<String> argv) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(argv).redirectErrorStream(true).start();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (InputStream input = process.getInputStream()) {
            input.transferTo(output);
        }
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException("Command timed out after " + timeout + ": " + String.join(" ", argv));
        }
        return new CommandResult(process.exitValue(), output.toString(StandardCharsets.UTF_8));
    }

    private static void requireSuccess(CommandResult result, String action) throws IOException {
        if (!result.succeeded()) {
            throw new IOException("Failed to " + action + " (exit " + result.exitCode() + "): " + result.output().trim());
        }
    }
}
