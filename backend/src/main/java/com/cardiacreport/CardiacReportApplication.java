package com.cardiacreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CardiacReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardiacReportApplication.class, args);
    }
}
