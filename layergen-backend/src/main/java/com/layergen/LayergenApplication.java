package com.layergen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LayergenApplication {

    public static void main(String[] args) {
        SpringApplication.run(LayergenApplication.class, args);
    }
}
