package com.pharma.signal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SignalMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalMonitorApplication.class, args);
    }
}
