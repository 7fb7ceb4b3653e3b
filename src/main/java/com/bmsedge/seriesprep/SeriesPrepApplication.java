package com.bmsedge.seriesprep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeriesPrepApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeriesPrepApplication.class, args);
    }
}
