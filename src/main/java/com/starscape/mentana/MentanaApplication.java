package com.starscape.mentana;

import com.starscape.mentana.common.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class MentanaApplication {

    public static void main(String[] args) {
        SpringApplication.run(MentanaApplication.class, args);
    }
}
