package com.phillippitts.feedercontrol.service.device;

import java.io.IOException;

/**
 * An open, line-oriented serial link.
 *
 * <p>Reads are bounded by the read timeout the connection was opened with, so a reader thread
 * can always observe its stop signal. Implementations keep a partially received line across
 * timed-out reads.
 */
public interface SerialConnection extends AutoCloseable {

    /**
     * @return the next complete line without its terminator, or {@code null} if none arrived
     *         within the read timeout
     * @throws IOException when the link is broken (device unplugged, port closed)
     */
    String readLine() throws IOException;

    void write(String data) throws IOException;

    boolean isOpen();

    /** Closes the port. Never throws. */
    @Override
    void close();
}
