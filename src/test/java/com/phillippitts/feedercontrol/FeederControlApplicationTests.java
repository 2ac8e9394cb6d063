package com.phillippitts.feedercontrol;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
        "device.enabled=false", // no serial hardware in CI
        "scheduler.auto-start=false",
        "scheduler.settings-cache-file=target/test-settings-cache.json"
    }
)
class FeederControlApplicationTests {

    @Test
    void contextLoads() {
    }

}
