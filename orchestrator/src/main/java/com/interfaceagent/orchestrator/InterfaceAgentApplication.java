package com.interfaceagent.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InterfaceAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterfaceAgentApplication.class, args);
    }
}
