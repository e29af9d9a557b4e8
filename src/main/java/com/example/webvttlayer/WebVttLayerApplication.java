package com.example.webvttlayer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WebVttLayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebVttLayerApplication.class, args);
    }
}
