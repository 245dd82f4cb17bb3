package com.pixelflow.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PixelFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(PixelFlowApplication.class, args);
    }
}
