package com.plyoox.stream.notifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@EnableFeignClients
@SpringBootApplication
public class StreamNotifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamNotifierApplication.class, args);
    }
}
