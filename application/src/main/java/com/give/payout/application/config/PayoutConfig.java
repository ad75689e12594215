package com.give.payout.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Configuration
public class PayoutConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Transaction boundary used by the execution guard around every mutating call
     */
    @Bean
    public TransactionTemplate payoutTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setName("payout-router");
        return template;
    }
}
