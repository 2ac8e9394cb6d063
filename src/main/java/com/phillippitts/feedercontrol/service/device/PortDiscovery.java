package com.phillippitts.feedercontrol.service.device;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the most likely microcontroller among the enumerated serial ports.
 *
 * <p>Scoring:
 * <ul>
 *   <li>+3 per description keyword: Arduino, CH340, FT232, CP210</li>
 *   <li>+2 for a USB-serial system path: ttyUSB, ttyACM</li>
 *   <li>+5 for a known vendor id: Arduino, WCH, FTDI, Silicon Labs</li>
 * </ul>
 * The highest positive score wins; on a tie the port enumerated first is kept.
 */
final class PortDiscovery {

    private static final Logger LOG = LogManager.getLogger(PortDiscovery.class);

    private static final List<String> KEYWORDS = List.of("arduino", "ch340", "ft232", "cp210");
    private static final List<String> PATH_PATTERNS = List.of("ttyusb", "ttyacm");
    private static final Set<Integer> VENDOR_IDS = Set.of(0x2341, 0x1A86, 0x0403, 0x10C4);

    private final SerialPortProvider provider;

    PortDiscovery(SerialPortProvider provider) {
        this.provider = provider;
    }

    Optional<String> discover() {
        List<PortDescriptor> ports;
        try {
            ports = provider.listPorts();
        } catch (RuntimeException e) {
            LOG.warn("Serial port enumeration failed: {}", e.toString());
            return Optional.empty();
        }
        PortDescriptor best = null;
        int bestScore = 0;
        for (PortDescriptor port : ports) {
            int score = score(port);
            LOG.debug("Port {} ({}) scored {}", port.systemPath(), port.description(), score);
            if (score > bestScore) {
                best = port;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best).map(PortDescriptor::systemPath);
    }

    static int score(PortDescriptor port) {
        int score = 0;
        String description = port.description().toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (description.contains(keyword)) {
                score += 3;
            }
        }
        String path = port.systemPath() == null ? "" : port.systemPath().toLowerCase(Locale.ROOT);
        for (String pattern : PATH_PATTERNS) {
            if (path.contains(pattern)) {
                score += 2;
            }
        }
        if (VENDOR_IDS.contains(port.vendorId())) {
            score += 5;
        }
        return score;
    }
}
