package com.vidnyan.eqlint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * eqlint - JavaScript lint engine.
 *
 * Uses the Closure Compiler parser and pluggable rules.
 */
@SpringBootApplication
public class EqlintApplication {

    public static void main(String[] args) {
        SpringApplication.run(EqlintApplication.class, args);
    }
}
