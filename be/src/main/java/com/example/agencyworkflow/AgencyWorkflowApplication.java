package com.example.agencyworkflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgencyWorkflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgencyWorkflowApplication.class, args);
    }
}
