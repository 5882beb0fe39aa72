package com.len.gate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class TicketingGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicketingGateApplication.class, args);
    }

}
