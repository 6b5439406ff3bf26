package com.optionengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionEngineApplication.class, args);
    }
}
