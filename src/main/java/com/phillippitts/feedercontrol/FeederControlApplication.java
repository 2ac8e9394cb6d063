package com.phillippitts.feedercontrol;

import com.phillippitts.feedercontrol.config.properties.DeviceLinkProperties;
import com.phillippitts.feedercontrol.config.properties.RemoteStoreProperties;
import com.phillippitts.feedercontrol.config.properties.SchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SchedulerProperties.class,
        DeviceLinkProperties.class,
        RemoteStoreProperties.class
})
@EnableScheduling
public class FeederControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeederControlApplication.class, args);
    }

}
