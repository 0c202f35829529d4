package com.chatrelay.coordinator.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.chatrelay.coordinator")
@EnableScheduling
public class ChatRelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChatRelayApplication.class, args);
    }
}
