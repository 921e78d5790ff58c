package com.openstay.stay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication(scanBasePackages = {"com.openstay.stay", "com.openstay.common"})
@EnableRetry
public class StayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(StayServiceApplication.class, args);
    }
}
