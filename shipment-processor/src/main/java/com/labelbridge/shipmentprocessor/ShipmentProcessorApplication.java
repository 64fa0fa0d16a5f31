package com.labelbridge.shipmentprocessor;

import com.labelbridge.shipmentprocessor.cli.ShipmentUploadCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties
public class ShipmentProcessorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ShipmentProcessorApplication.class, args);
        if (!context.getBeansOfType(ShipmentUploadCommand.class).isEmpty()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
