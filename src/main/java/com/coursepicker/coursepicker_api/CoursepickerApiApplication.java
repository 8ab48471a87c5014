package com.coursepicker.coursepicker_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoursepickerApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoursepickerApiApplication.class, args);
    }
}
