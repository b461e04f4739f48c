package com.meterpay.protocol;

import com.meterpay.domain.ServiceConfig;
import com.meterpay.domain.ServiceConfigRepository;
import com.meterpay.domain.ServiceType;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Cached read access to service_configs.
 */
@Component
@RequiredArgsConstructor
public class ServiceCatalog {

    private final ServiceConfigRepository serviceConfigRepository;

    @Cacheable(cacheNames = "serviceConfigCache", key = "#serviceType.name() + ':' + #serviceId")
    public Optional<ServiceConfig> find(String serviceId, ServiceType serviceType) {
        return serviceConfigRepository.findByServiceIdAndServiceType(serviceId, serviceType);
    }
}
