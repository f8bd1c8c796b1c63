package com.example.readcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ReadCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReadCacheApplication.class, args);
    }
}
