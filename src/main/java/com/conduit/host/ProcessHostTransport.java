package com.conduit.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link HostTransport} over the stdio of a child process.
 *
 * Protocol lines travel over stdin and stdout; stderr is diagnostic output. Writes go
 * through a bounded queue drained by a dedicated thread, so a slow child never blocks
 * the gateway: when the queue is full, new lines are dropped.
 */
public class ProcessHostTransport implements HostTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessHostTransport.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private static final String END_OF_INPUT = new String("\u0000eof");

    private final String name;
    private final List<String> command;
    private final Path workingDirectory;
    private final BlockingQueue<String> outbound;
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();

    private volatile Process process;
    private volatile boolean inputClosed;

    /**
     * @param name a short name for thread names and logs, usually the extension id
     * @param command the command line that starts the child
     * @param workingDirectory the child's working directory, or null to inherit the gateway's
     */
    public ProcessHostTransport(String name, List<String> command, Path workingDirectory) {
        this(name, command, workingDirectory, DEFAULT_QUEUE_CAPACITY);
    }

    public ProcessHostTransport(String name, List<String> command, Path workingDirectory, int queueCapacity) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.outbound = new ArrayBlockingQueue<>(queueCapacity);
    }

    @Override
    public void start(Listener listener) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        Process started = builder.start();
        this.process = started;
        LOGGER.info("Started extension host '{}' (pid {})", name, started.pid());

        startThread("host-" + name + "-stdout", () -> readLines(started.getInputStream(), listener::onLine));
        startThread("host-" + name + "-stderr", () -> readLines(started.getErrorStream(), listener::onDiagnostic));
        startThread("host-" + name + "-stdin", () -> writeLines(started));

        started.onExit().thenAccept(p -> exit.complete(p.exitValue()));
    }

    @Override
    public boolean send(String line) {
        if (inputClosed || process == null) {
            return false;
        }
        if (!outbound.offer(line)) {
            LOGGER.warn("Outbound queue for extension host '{}' is full ({} messages), dropping message",
                name, outbound.size());
            return false;
        }
        return true;
    }

    @Override
    public void closeInput() {
        if (inputClosed) {
            return;
        }
        inputClosed = true;
        outbound.clear();
        outbound.offer(END_OF_INPUT);
    }

    @Override
    public void terminate() {
        Process current = process;
        if (current != null) {
            current.destroy();
        }
    }

    @Override
    public void destroyForcibly() {
        inputClosed = true;
        Process current = process;
        if (current != null) {
            current.destroyForcibly();
        }
    }

    @Override
    public boolean isAlive() {
        Process current = process;
        return current != null && current.isAlive();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    private void readLines(InputStream stream, Consumer<String> consumer) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    consumer.accept(line.trim());
                }
            }
        } catch (IOException e) {
            LOGGER.debug("Stream of extension host '{}' closed: {}", name, e.getMessage());
        }
    }

    private void writeLines(Process target) {
        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(target.getOutputStream(), StandardCharsets.UTF_8))) {
            while (target.isAlive()) {
                String line = outbound.poll(500, TimeUnit.MILLISECONDS);
                if (line == null) {
                    continue;
                }
                if (line == END_OF_INPUT) {
                    break;
                }
                writer.write(line);
                writer.write('\n');
                if (outbound.isEmpty()) {
                    writer.flush();
                }
            }
        } catch (IOException e) {
            LOGGER.debug("Input of extension host '{}' closed: {}", name, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void startThread(String threadName, Runnable task) {
        Thread thread = new Thread(task, threadName);
        thread.setDaemon(true);
        thread.start();
    }
}
