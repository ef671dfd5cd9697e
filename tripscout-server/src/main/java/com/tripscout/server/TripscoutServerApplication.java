package com.tripscout.server;

import com.tripscout.common.properties.AdapterProperties;
import com.tripscout.common.properties.ResearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({ResearchProperties.class, AdapterProperties.class})
public class TripscoutServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripscoutServerApplication.class, args);
    }
}
