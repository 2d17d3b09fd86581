package com.portfoliotrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PortfolioTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioTraderApplication.class, args);
    }
}
