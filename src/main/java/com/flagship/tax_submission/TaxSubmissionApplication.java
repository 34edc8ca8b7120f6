package com.flagship.tax_submission;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxSubmissionApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaxSubmissionApplication.class, args);
    }
}
