package com.meterpay.domain;

/**
 * Kind of metered resource a usage record is charged for.
 */
public enum ResourceType {
    AGENT_EXECUTION(ServiceType.AGENT),
    API_CALL(ServiceType.API),
    DATA_ACCESS(ServiceType.WEB_SERVICE);

    private final ServiceType serviceType;

    ResourceType(ServiceType serviceType) {
        this.serviceType = serviceType;
    }

    public ServiceType serviceType() {
        return serviceType;
    }

    public static ResourceType forServiceType(ServiceType serviceType) {
        for (ResourceType type : values()) {
            if (type.serviceType == serviceType) {
                return type;
            }
        }
        throw new IllegalArgumentException("No resource type for " + serviceType);
    }
}
