package com.meterpay.settlement.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ SettlementProperties.class, MonitorProperties.class })
public class SettlementConfig {
}
