package com.openforge.connectors;

import com.openforge.connectors.config.ConnectorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ConnectorProperties.class)
public class VendorConnectorsApplication {

    public static void main(String[] args) {
        SpringApplication.run(VendorConnectorsApplication.class, args);
    }
}
