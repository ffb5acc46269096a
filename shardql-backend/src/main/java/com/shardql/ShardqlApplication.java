package com.shardql;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ShardqlApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShardqlApplication.class, args);
    }
}
