package com.sqlframe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlFrameApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlFrameApplication.class, args);
    }
}
