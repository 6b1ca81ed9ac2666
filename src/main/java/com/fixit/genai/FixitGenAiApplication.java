package com.fixit.genai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FixitGenAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FixitGenAiApplication.class, args);
    }
}
