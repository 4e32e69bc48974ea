package com.layergen.config;

import com.layergen.oracle.OracleConfig;
import com.layergen.oracle.RetryPolicy;
import com.layergen.oracle.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
public class LayergenConfiguration {

    @Bean
    public OracleConfig oracleConfig(Environment environment) {
        return OracleConfig.fromEnvironment(environment);
    }

    @Bean
    public RetryPolicy oracleRetryPolicy(OracleConfig oracleConfig) {
        return oracleConfig.retryPolicy();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
