package com.proofsmith;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProofSmithApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProofSmithApplication.class, args);
    }
}
