package com.procurement.risk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProcurementRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProcurementRiskApplication.class, args);
    }
}
