package com.tempvoice.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TempVoice application entry point.
 */
@SpringBootApplication
public class TempVoiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TempVoiceApplication.class, args);
    }
}
