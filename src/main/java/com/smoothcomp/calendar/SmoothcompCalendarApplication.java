package com.smoothcomp.calendar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmoothcompCalendarApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmoothcompCalendarApplication.class, args);
    }
}
