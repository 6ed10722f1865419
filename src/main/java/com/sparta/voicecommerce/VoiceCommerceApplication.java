package com.sparta.voicecommerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoiceCommerceApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceCommerceApplication.class, args);
    }
}
