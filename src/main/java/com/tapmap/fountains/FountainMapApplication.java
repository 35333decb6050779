package com.tapmap.fountains;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class FountainMapApplication {

    public static void main(String[] args) {
        SpringApplication.run(FountainMapApplication.class, args);
    }
}
