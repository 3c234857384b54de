package com.flagship.order_payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OrderPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderPaymentsApplication.class, args);
    }
}
