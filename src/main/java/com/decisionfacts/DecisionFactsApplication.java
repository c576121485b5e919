package com.decisionfacts;

import com.decisionfacts.pipeline.DecisionFactsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DecisionFactsProperties.class)
public class DecisionFactsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecisionFactsApplication.class, args);
    }
}
