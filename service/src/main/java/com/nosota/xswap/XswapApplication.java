package com.nosota.xswap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class XswapApplication {

    public static void main(String[] args) {
        SpringApplication.run(XswapApplication.class, args);
    }
}
