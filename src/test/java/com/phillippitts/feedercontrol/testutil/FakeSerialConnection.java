package com.phillippitts.feedercontrol.testutil;

import com.phillippitts.feedercontrol.service.device.SerialConnection;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * In-memory serial connection. Inbound lines are queued by the test (or by the responder when a
 * command is written); reads poll with a short timeout like a real port opened semi-blocking.
 */
public class FakeSerialConnection implements SerialConnection {

    private static final long READ_POLL_MILLIS = 20;

    private final String path;
    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    private final List<String> written = new CopyOnWriteArrayList<>();
    private volatile Function<String, List<String>> responder = data -> List.of();
    private volatile boolean open;
    private volatile boolean unplugged;

    public FakeSerialConnection(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }

    /** Queues a raw line as if the device printed it. */
    public void emit(String line) {
        inbound.add(line);
    }

    /**
     * Sets the reply produced for every write. The function receives the raw written text,
     * including the control prefix and newline.
     */
    public void respondWith(Function<String, List<String>> responder) {
        this.responder = responder;
    }

    public List<String> written() {
        return List.copyOf(written);
    }

    void markOpen() {
        open = true;
    }

    void unplug() {
        unplugged = true;
        open = false;
    }

    @Override
    public String readLine() throws IOException {
        if (unplugged) {
            throw new IOException("Device unplugged: " + path);
        }
        if (!open) {
            throw new IOException("Port closed: " + path);
        }
        try {
            String line = inbound.poll(READ_POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (unplugged) {
                throw new IOException("Device unplugged: " + path);
            }
            return line;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    @Override
    public void write(String data) throws IOException {
        if (unplugged || !open) {
            throw new IOException("Port not writable: " + path);
        }
        written.add(data);
        inbound.addAll(responder.apply(data));
    }

    @Override
    public boolean isOpen() {
        return open && !unplugged;
    }

    @Override
    public void close() {
        open = false;
    }
}
