package com.summaryplatform.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SummarizationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SummarizationEngineApplication.class, args);
    }
}
