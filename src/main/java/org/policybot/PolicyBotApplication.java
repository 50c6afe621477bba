package org.policybot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PolicyBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyBotApplication.class, args);
    }
}
