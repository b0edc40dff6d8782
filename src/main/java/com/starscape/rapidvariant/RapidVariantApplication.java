package com.starscape.rapidvariant;

import com.starscape.rapidvariant.common.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class RapidVariantApplication {

    public static void main(String[] args) {
        SpringApplication.run(RapidVariantApplication.class, args);
    }
}
