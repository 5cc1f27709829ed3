package com.starscape.parkfaces;

import com.starscape.parkfaces.common.config.FaceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FaceProperties.class)
public class ParkFacesApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParkFacesApplication.class, args);
    }
}
