package com.example.photomap.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;

import java.time.Clock;

@Configuration
public class PersistenceConfig {

    // Multi-document writes (identity + passkey + invite + grants, recovery claim + passkey wipe)
    // need a replica set or sharded cluster.
    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
