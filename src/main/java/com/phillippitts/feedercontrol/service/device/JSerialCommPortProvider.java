package com.phillippitts.feedercontrol.service.device;

import com.fazecast.jSerialComm.SerialPort;
import com.fazecast.jSerialComm.SerialPortTimeoutException;
import com.phillippitts.feedercontrol.config.properties.DeviceLinkProperties;
import com.phillippitts.feedercontrol.exception.DeviceConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Production {@link SerialPortProvider} backed by jSerialComm.
 */
@Component
public class JSerialCommPortProvider implements SerialPortProvider {

    private static final Logger LOG = LogManager.getLogger(JSerialCommPortProvider.class);

    private final int maxLineLength;

    public JSerialCommPortProvider(DeviceLinkProperties props) {
        this.maxLineLength = props.getMaxLineLength();
    }

    @Override
    public List<PortDescriptor> listPorts() {
        List<PortDescriptor> result = new ArrayList<>();
        for (SerialPort port : SerialPort.getCommPorts()) {
            String description = port.getPortDescription() + " " + port.getDescriptivePortName();
            result.add(new PortDescriptor(port.getSystemPortPath(), description.trim(), port.getVendorID()));
        }
        return result;
    }

    @Override
    public SerialConnection open(String address, int baudRate, Duration readTimeout) {
        SerialPort port;
        try {
            port = SerialPort.getCommPort(address);
        } catch (RuntimeException e) {
            throw new DeviceConnectionException("Serial port not found", address, e);
        }
        port.setComPortParameters(baudRate, 8, SerialPort.ONE_STOP_BIT, SerialPort.NO_PARITY);
        port.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING, (int) readTimeout.toMillis(), 0);
        if (!port.openPort()) {
            throw new DeviceConnectionException(
                    "Cannot open serial port (busy, missing or permission denied), error code "
                            + port.getLastErrorCode(), address);
        }
        LOG.info("Opened serial port {} at {} baud", address, baudRate);
        return new Connection(port, maxLineLength);
    }

    /** Byte-wise line reader that survives read timeouts without losing a partial line. */
    private static final class Connection implements SerialConnection {

        private final SerialPort port;
        private final InputStream in;
        private final int maxLineLength;
        private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

        Connection(SerialPort port, int maxLineLength) {
            this.port = port;
            this.in = port.getInputStream();
            this.maxLineLength = maxLineLength;
        }

        @Override
        public String readLine() throws IOException {
            while (true) {
                int b;
                try {
                    b = in.read();
                } catch (SerialPortTimeoutException timeout) {
                    return null;
                }
                if (b < 0) {
                    throw new IOException("Serial stream closed");
                }
                if (b == '\n') {
                    String line = partial.toString(StandardCharsets.UTF_8);
                    partial.reset();
                    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
                }
                if (partial.size() < maxLineLength) {
                    partial.write(b);
                }
            }
        }

        @Override
        public void write(String data) throws IOException {
            byte[] bytes = data.getBytes(StandardCharsets.UTF_8);
            int written = port.writeBytes(bytes, bytes.length);
            if (written < bytes.length) {
                throw new IOException("Short write to " + port.getSystemPortPath() + ": " + written + "/" + bytes.length);
            }
        }

        @Override
        public boolean isOpen() {
            return port.isOpen();
        }

        @Override
        public void close() {
            if (!port.closePort()) {
                LOG.debug("closePort() reported failure for {}", port.getSystemPortPath());
            }
        }
    }
}
