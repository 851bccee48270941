package fr.imt.shellbridge.shellbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ShellbridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShellbridgeApplication.class, args);
    }

}
