package com.meterpay.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ServiceConfigRepository extends MongoRepository<ServiceConfig, String> {

    Optional<ServiceConfig> findByServiceIdAndServiceType(String serviceId, ServiceType serviceType);
}
