package com.nosota.wagerbook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WagerbookApplication {
    public static void main(String[] args) {
        SpringApplication.run(WagerbookApplication.class, args);
    }
}
