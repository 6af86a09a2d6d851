package dev.kappalib.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;

@Configuration(proxyBeanMethods = false)
@Slf4j
public class SecureRandomConfig {

    /**
     * Single CSPRNG shared by every generator of tokens, codes and ids.
     */
    @Bean
    public SecureRandom secureRandom() {
        SecureRandom random = new SecureRandom();
        log.info("SecureRandom initialised (algorithm={})", random.getAlgorithm());
        return random;
    }
}
