package com.give.payout.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Payout router service entry point
 */
@SpringBootApplication(scanBasePackages = "com.give.payout")
@EnableKafka
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.give.payout.infrastructure.persistence.repository")
@EntityScan(basePackages = "com.give.payout.infrastructure.persistence.entity")
public class PayoutRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayoutRouterApplication.class, args);
    }
}
