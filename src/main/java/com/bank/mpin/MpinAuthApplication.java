package com.bank.mpin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MpinAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(MpinAuthApplication.class, args);
    }
}
