package org.buaa.datastd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataStandardApp {

    public static void main(String[] args) {
        SpringApplication.run(DataStandardApp.class, args);
    }
}
