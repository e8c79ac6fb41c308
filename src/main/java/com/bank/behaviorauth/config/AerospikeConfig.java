package com.bank.behaviorauth.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike connection for the decision audit trail and phase-state snapshots.
 * Disabled with {@code aerospike.enabled=false} (tests supply mock beans instead).
 */
@Getter
@Configuration
@ConditionalOnProperty(name = "aerospike.enabled", havingValue = "true", matchIfMissing = true)
public class AerospikeConfig {

    public static final String SET_DECISIONS = "auth_decisions";
    public static final String SET_PHASE_STATES = "learning_phases";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:behavioral_auth}")
    private String namespace;

    // Audit writes sit on the decision path, so they get a tighter budget than bulk reads
    @Value("${aerospike.write-timeout-ms:50}")
    private int writeTimeoutMs;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 300;
        clientPolicy.timeout = 5000;
        clientPolicy.failIfNotConnected = false;

        clientPolicy.readPolicyDefault.totalTimeout = 1000;
        clientPolicy.readPolicyDefault.socketTimeout = 500;

        clientPolicy.writePolicyDefault.totalTimeout = writeTimeoutMs;
        clientPolicy.writePolicyDefault.socketTimeout = writeTimeoutMs;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = writeTimeoutMs;
        policy.socketTimeout = writeTimeoutMs;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
