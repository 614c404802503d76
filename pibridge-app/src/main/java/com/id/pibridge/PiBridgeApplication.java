package com.id.pibridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PiBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PiBridgeApplication.class, args);
    }

}
