package com.vedant.sqlgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlGatewayApplication {
    public static void main(String[] args) {
        SpringApplication.run(SqlGatewayApplication.class, args);
    }
}
