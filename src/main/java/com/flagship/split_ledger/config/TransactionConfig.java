package com.flagship.split_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Programmatic transaction template used by the concurrency controller.
 *
 * Each mutation attempt runs in its own transaction with a bounded timeout.
 */
@Configuration
public class TransactionConfig {

    @Bean
    public TransactionTemplate mutationTransactionTemplate(PlatformTransactionManager transactionManager,
                                                           LedgerProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout((int) Math.max(1, properties.getMutation().getTransactionTimeout().toSeconds()));
        return template;
    }
}
