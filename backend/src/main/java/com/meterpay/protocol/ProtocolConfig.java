package com.meterpay.protocol;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ProtocolProperties.class)
public class ProtocolConfig {
}
