package com.agentid.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * AgentID Platform API Application
 *
 * Cryptographic identities and an append-only reputation ledger for software agents.
 */
@SpringBootApplication(scanBasePackages = "com.agentid")
@EntityScan(basePackages = "com.agentid.core.domain")
@EnableJpaRepositories(basePackages = "com.agentid.core.repository")
public class AgentIdApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentIdApplication.class, args);
    }
}
