package com.firewall.adapter.spring;

import com.firewall.config.ConfigLocator;
import com.firewall.config.FirewallConfig;
import com.firewall.core.Platform;
import com.firewall.hook.HookAdapter;
import com.firewall.policy.PolicyEngine;
import com.firewall.policy.PolicyEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the command firewall.
 */
@Configuration
@ConditionalOnProperty(prefix = "firewall", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FirewallProperties.class)
public class FirewallAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FirewallAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Platform firewallPlatform(FirewallProperties properties) {
        Platform platform = Platform.parse(properties.getPlatform());
        log.debug("Firewall platform: {}", platform);
        return platform;
    }

    @Bean
    @ConditionalOnMissingBean
    public FirewallConfig firewallConfig(FirewallProperties properties, Platform platform) {
        return ConfigLocator.system(properties.getConfigPath(), platform).locate();
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyEngine policyEngine(FirewallConfig config, Platform platform) {
        log.debug("Creating PolicyEngine for {} with {} rules", platform, config.size());
        return PolicyEngineFactory.create(config, platform);
    }

    @Bean
    @ConditionalOnMissingBean
    public HookAdapter hookAdapter(PolicyEngine policyEngine) {
        return new HookAdapter(policyEngine);
    }
}
