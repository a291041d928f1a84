package io.ussopmm.ems.simulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeviceSimulatorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeviceSimulatorServiceApplication.class, args);
    }

}
