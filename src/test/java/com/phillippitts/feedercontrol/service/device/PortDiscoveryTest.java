package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.testutil.FakeSerialPortProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PortDiscoveryTest {

    @Test
    void scoresKeywordsPathAndVendor() {
        assertThat(PortDiscovery.score(new PortDescriptor("/dev/ttyUSB0", "USB-SERIAL CH340", 0x1A86))).isEqualTo(10);
        assertThat(PortDiscovery.score(new PortDescriptor("/dev/ttyACM0", "Arduino Uno", -1))).isEqualTo(5);
        assertThat(PortDiscovery.score(new PortDescriptor("COM3", "Silicon Labs CP2102", 0x10C4))).isEqualTo(8);
        assertThat(PortDiscovery.score(new PortDescriptor("/dev/ttyS0", "", -1))).isZero();
    }

    @Test
    void picksHighestScore() {
        FakeSerialPortProvider ports = new FakeSerialPortProvider();
        ports.plug("/dev/ttyACM0", "", -1);
        ports.plug("/dev/ttyUSB3", "FT232R USB UART", 0x0403);

        assertThat(new PortDiscovery(ports).discover()).contains("/dev/ttyUSB3");
    }

    @Test
    void tieKeepsFirstEnumeratedPort() {
        FakeSerialPortProvider ports = new FakeSerialPortProvider();
        ports.plug("/dev/ttyUSB1", "CH340", -1);
        ports.plug("/dev/ttyUSB0", "CH340", -1);

        assertThat(new PortDiscovery(ports).discover()).contains("/dev/ttyUSB1");
    }

    @Test
    void returnsEmptyWhenNothingLooksLikeDevice() {
        FakeSerialPortProvider ports = new FakeSerialPortProvider();
        ports.addUnopenablePort("/dev/ttyS0", "Built-in serial", -1);

        assertThat(new PortDiscovery(ports).discover()).isEmpty();
    }

    @Test
    void enumerationFailureReadsAsNoDevice() {
        SerialPortProvider broken = new SerialPortProvider() {
            @Override
            public List<PortDescriptor> listPorts() {
                throw new IllegalStateException("native library missing");
            }

            @Override
            public SerialConnection open(String address, int baudRate, Duration readTimeout) {
                throw new UnsupportedOperationException();
            }
        };

        assertThat(new PortDiscovery(broken).discover()).isEmpty();
    }
}
