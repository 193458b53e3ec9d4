package com.itguru;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class ItGuruApplication {

    public static void main(String[] args) {
        log.info("Starting IT-Guru assistant");
        SpringApplication.run(ItGuruApplication.class, args);
        log.info("IT-Guru assistant started");
    }

}
