package com.eainde.manuscript;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ManuscriptPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ManuscriptPipelineApplication.class, args);
    }
}
