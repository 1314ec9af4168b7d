package com.picframe.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PicframeCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(PicframeCacheApplication.class, args);
    }
}
