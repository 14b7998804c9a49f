package com.photonlab.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PhotonLabApplication {
    public static void main(String[] args) {
        SpringApplication.run(PhotonLabApplication.class, args);
    }
}
