package com.budgetbridge.ynab;

import com.budgetbridge.ynab.config.YnabProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(YnabProperties.class)
public class YnabToolsApplication {

    public static void main(String[] args) {
        SpringApplication.run(YnabToolsApplication.class, args);
    }
}
