package com.flagship.member_payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MemberPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemberPaymentsApplication.class, args);
    }
}
