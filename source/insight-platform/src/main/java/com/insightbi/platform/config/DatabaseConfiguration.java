package com.insightbi.platform.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableJpaRepositories({ "com.insightbi.platform.repository" })
@EnableTransactionManagement
public class DatabaseConfiguration {}
