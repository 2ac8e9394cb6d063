package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.config.properties.DeviceLinkProperties;
import com.phillippitts.feedercontrol.exception.DeviceConnectionException;
import com.phillippitts.feedercontrol.service.metrics.FeederMetrics;
import com.phillippitts.feedercontrol.util.LogSanitizer;
import com.phillippitts.feedercontrol.util.TimeUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the serial link to the feeder microcontroller.
 *
 * <p>A dedicated reader thread runs for the lifetime of the link. It parses each line once,
 * feeds data frames into {@link SensorReadingStore}, offers info lines to pending commands, and
 * expires overdue commands on every iteration.
 *
 * <p>Recovery model:
 * <ul>
 *   <li>On an I/O error the link is closed, every pending command fails, and the port list is
 *       rescanned; the address is replaced only when a different device port is found.</li>
 *   <li>Reconnects are bounded: up to {@code device.max-reconnect-attempts} tries spaced by
 *       {@code device.reconnect-delay}, then one {@code device.reconnect-cooldown}, then the
 *       counter resets. This repeats until the link is stopped.</li>
 * </ul>
 *
 * <p>Connection loss is never fatal: it shows as {@link LinkState#DISCONNECTED} in
 * {@link #status()} and commands fail fast meanwhile.
 */
@Component
public class DeviceLink {

    private static final Logger LOG = LogManager.getLogger(DeviceLink.class);

    static final String CONTROL_PREFIX = "[control]:";
    private static final int LOG_PREVIEW_CHARS = 200;
    private static final Duration READER_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final DeviceLinkProperties props;
    private final SerialPortProvider provider;
    private final PortDiscovery discovery;
    private final DeviceFrameParser parser;
    private final SensorReadingStore readings;
    private final PendingCommandTable pending = new PendingCommandTable();
    private final ApplicationEventPublisher publisher;
    private final FeederMetrics metrics;
    private final ThreadFactory threadFactory;
    private final Clock clock;

    private final ReentrantLock connectLock = new ReentrantLock();
    private final Object writeLock = new Object();
    private final Object readerLock = new Object();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();

    private volatile LinkState state = LinkState.DISCONNECTED;
    private volatile String address;
    private volatile SerialConnection connection;
    private volatile String lastError;
    private volatile Instant lastFrameAt;

    // Guarded by readerLock
    private Thread reader;
    private CountDownLatch readerStop = new CountDownLatch(0);

    public DeviceLink(DeviceLinkProperties props,
                      SerialPortProvider provider,
                      SensorReadingStore readings,
                      ApplicationEventPublisher publisher,
                      FeederMetrics metrics,
                      @Qualifier("deviceReaderThreadFactory") ThreadFactory threadFactory,
                      Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.readings = Objects.requireNonNull(readings, "readings");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.discovery = new PortDiscovery(provider);
        this.parser = new DeviceFrameParser(props.getDataPrefix(), props.getInfoPrefix(), clock);
        String configured = props.getAddress();
        this.address = configured == null || configured.isBlank() ? null : configured.trim();
    }

    @PostConstruct
    void init() {
        if (props.isEnabled()) {
            start();
        } else {
            LOG.info("Device link disabled (device.enabled=false)");
        }
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    /**
     * Starts the reader thread. The reader connects (discovering the port if no address is
     * configured) and keeps the link alive until {@link #stop()}.
     */
    public void start() {
        synchronized (readerLock) {
            if (reader != null && reader.isAlive()) {
                LOG.warn("Device reader already running");
                return;
            }
            CountDownLatch stop = new CountDownLatch(1);
            readerStop = stop;
            reader = threadFactory.newThread(() -> readLoop(stop));
            reader.start();
        }
    }

    /**
     * Stops the reader, closes the port and fails every pending command. Idempotent.
     */
    public void stop() {
        Thread current;
        synchronized (readerLock) {
            current = reader;
            reader = null;
            readerStop.countDown();
        }
        if (current != null && current != Thread.currentThread()) {
            try {
                current.join(READER_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (current.isAlive()) {
                LOG.warn("Device reader did not stop within {}ms", READER_JOIN_TIMEOUT.toMillis());
            }
        }
        SerialConnection open = connection;
        connection = null;
        if (open != null) {
            open.close();
        }
        pending.failAll("Device link stopped");
        setState(LinkState.DISCONNECTED, "stopped");
    }

    /**
     * Scans the serial ports for the most likely device. Read-only.
     *
     * @return system path of the best candidate
     */
    public Optional<String> discover() {
        return discovery.discover();
    }

    /**
     * Opens the port at {@code target}, replacing any current connection. No internal retry.
     *
     * @return {@code true} once connected
     * @throws DeviceConnectionException when the port is busy, missing or access is denied
     */
    public boolean connect(String target) {
        Objects.requireNonNull(target, "target");
        connectLock.lock();
        try {
            SerialConnection previous = connection;
            connection = null;
            if (previous != null) {
                previous.close();
                pending.failAll("Device link replaced by connect to " + target);
            }
            // CONNECTING is only ever entered from DISCONNECTED
            setState(LinkState.DISCONNECTED, "reconnecting");
            address = target;
            setState(LinkState.CONNECTING, null);
            SerialConnection opened;
            try {
                opened = provider.open(target, props.getBaudRate(), props.getReadTimeout());
            } catch (DeviceConnectionException e) {
                lastError = e.getMessage();
                setState(LinkState.DISCONNECTED, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                lastError = e.toString();
                setState(LinkState.DISCONNECTED, e.toString());
                throw new DeviceConnectionException("Cannot open serial port", target, e);
            }
            connection = opened;
            reconnectAttempts.set(0);
            setState(LinkState.CONNECTED, null);
            return true;
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * Writes {@code [control]:<text>} followed by a newline.
     *
     * @return {@code false} without throwing when no link is open or the write fails
     */
    public boolean sendCommand(String text) {
        SerialConnection conn = connection;
        if (state != LinkState.CONNECTED || conn == null) {
            LOG.debug("Command '{}' not sent: device not connected", LogSanitizer.printable(text, LOG_PREVIEW_CHARS));
            return false;
        }
        try {
            synchronized (writeLock) {
                conn.write(CONTROL_PREFIX + text + "\n");
            }
            LOG.debug("Sent command '{}'", LogSanitizer.printable(text, LOG_PREVIEW_CHARS));
            return true;
        } catch (IOException e) {
            lastError = e.getMessage();
            LOG.warn("Failed to send command '{}': {}", LogSanitizer.printable(text, LOG_PREVIEW_CHARS), e.toString());
            return false;
        }
    }

    /**
     * Sends a command and waits for the response lines its {@link ResponseRule} expects.
     *
     * <p>Fails fast when disconnected. Never blocks longer than {@code timeout}; the pending
     * entry is always removed before returning.
     *
     * @throws IllegalArgumentException when the text has no command family before its first ':'
     */
    public CommandResult sendCommandAwaitResponse(String text, Duration timeout) {
        if (text == null || ResponseRule.familyOf(text).isEmpty()) {
            throw new IllegalArgumentException("Command needs a family before its first ':', got '"
                    + LogSanitizer.printable(text, LOG_PREVIEW_CHARS) + "'");
        }
        if (!isConnected()) {
            metrics.incrementCommand("disconnected");
            return CommandResult.failed(text, new DeviceConnectionException("Device not connected"));
        }
        PendingCommand entry = pending.register(text, ResponseRule.forCommand(text), clock.instant().plus(timeout));
        try {
            if (!sendCommand(text)) {
                metrics.incrementCommand("disconnected");
                return CommandResult.failed(text, new DeviceConnectionException("Failed to send command", address));
            }
            entry.await(timeout);
            CommandResult result = entry.result(timeout);
            metrics.incrementCommand(result.success() ? "success" : result.timedOut() ? "timeout" : "disconnected");
            return result;
        } finally {
            pending.remove(entry.id());
        }
    }

    /**
     * Queries the device's sensor service with {@code sensors:status}.
     */
    public SensorServiceStatus sensorsStatus() {
        return SensorServiceStatus.from(sendCommandAwaitResponse("sensors:status", props.getCommandTimeout()));
    }

    public boolean isConnected() {
        return state == LinkState.CONNECTED && connection != null;
    }

    public LinkStatus status() {
        LinkState current = state;
        return new LinkStatus(current, address, current == LinkState.CONNECTED, reconnectAttempts.get(),
                lastError, pending.size(), lastFrameAt);
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        LOG.info("Device link: state={}, address={}, reconnectAttempts={}, pending={}",
                state, address, reconnectAttempts.get(), pending.size());
    }

    private void readLoop(CountDownLatch stop) {
        ThreadContext.put("component", "device-reader");
        LOG.info("Device reader started");
        try {
            while (stop.getCount() > 0) {
                pending.expireOverdue(clock.instant());
                SerialConnection conn = connection;
                if (conn == null) {
                    if (!reconnectWithBackoff(stop)) {
                        break;
                    }
                    continue;
                }
                if (!conn.isOpen()) {
                    onIoFailure(conn, new IOException("Serial port closed"));
                    continue;
                }
                String line;
                try {
                    line = conn.readLine();
                } catch (IOException e) {
                    onIoFailure(conn, e);
                    continue;
                }
                if (line != null) {
                    dispatch(line);
                }
            }
        } finally {
            LOG.info("Device reader stopped");
            ThreadContext.clearAll();
        }
    }

    private void dispatch(String line) {
        try {
            DeviceFrame frame = parser.parse(line);
            if (frame instanceof DeviceFrame.DataFrame data) {
                readings.update(data.reading());
                lastFrameAt = data.reading().updatedAt();
            } else if (frame instanceof DeviceFrame.InfoLine info) {
                int matched = pending.offer(info.text());
                LOG.info("Device: {} (pending matches={})", LogSanitizer.printable(info.text(), LOG_PREVIEW_CHARS), matched);
            } else if (frame instanceof DeviceFrame.Unrecognized unrecognized) {
                LOG.debug("Dropped device line ({}): {}", unrecognized.reason(),
                        LogSanitizer.printable(unrecognized.raw(), LOG_PREVIEW_CHARS));
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to handle device line '{}': {}", LogSanitizer.printable(line, LOG_PREVIEW_CHARS), e.toString());
        }
    }

    private void onIoFailure(SerialConnection failed, IOException cause) {
        connectLock.lock();
        try {
            if (connection != failed) {
                // Already replaced by a concurrent connect()
                failed.close();
                return;
            }
            connection = null;
            failed.close();
        } finally {
            connectLock.unlock();
        }
        lastError = cause.getMessage();
        LOG.warn("Device link lost on {}: {}", address, cause.toString());
        setState(LinkState.DISCONNECTED, cause.getMessage());
        pending.failAll("Device link lost: " + cause.getMessage());
        rediscover();
    }

    /** Replaces the address only when discovery finds a different candidate. */
    private void rediscover() {
        Optional<String> found = discovery.discover();
        if (found.isPresent() && !found.get().equals(address)) {
            LOG.info("Device rediscovered at {} (was {})", found.get(), address);
            address = found.get();
        }
    }

    /**
     * Bounded retry loop.
     *
     * @return {@code true} once connected, {@code false} when stopped
     */
    private boolean reconnectWithBackoff(CountDownLatch stop) {
        int max = props.getMaxReconnectAttempts();
        while (stop.getCount() > 0) {
            int attempt = reconnectAttempts.incrementAndGet();
            metrics.incrementReconnectAttempt();
            String target = address;
            if (target == null) {
                target = discovery.discover().orElse(null);
            }
            if (target == null) {
                lastError = "No serial device found";
                LOG.warn("No serial device found (attempt {}/{})", attempt, max);
            } else {
                try {
                    connect(target);
                    LOG.info("Device connected at {} after {} attempt(s)", target, attempt);
                    return true;
                } catch (DeviceConnectionException e) {
                    LOG.warn("Connect to {} failed (attempt {}/{}): {}", target, attempt, max, e.getMessage());
                    rediscover();
                }
            }
            boolean exhausted = attempt >= max;
            Duration wait = exhausted ? props.getReconnectCooldown() : props.getReconnectDelay();
            if (exhausted) {
                LOG.error("Device unreachable after {} attempts; cooling down for {}ms", attempt, wait.toMillis());
            }
            if (TimeUtils.awaitStop(stop, wait)) {
                return false;
            }
            if (exhausted) {
                reconnectAttempts.set(0);
            }
        }
        return false;
    }

    private synchronized void setState(LinkState next, String reason) {
        LinkState previous = state;
        state = next;
        if (previous != next) {
            LOG.info("Device link {} -> {} (address={}{})", previous, next, address,
                    reason == null ? "" : ", reason=" + reason);
            publisher.publishEvent(new LinkStateChangedEvent(previous, next, address, reason, clock.instant()));
        }
    }
}
