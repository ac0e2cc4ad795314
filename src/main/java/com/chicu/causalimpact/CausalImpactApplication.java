package com.chicu.causalimpact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.causalimpact")
public class CausalImpactApplication {

    public static void main(String[] args) {
        SpringApplication.run(CausalImpactApplication.class, args);
    }
}
