package com.purchasingpower.newsgraph.graph;

import com.purchasingpower.newsgraph.util.ServiceType;

/**
 * Concrete realizations of {@link KnowledgeGraphStore}, in the default fallback order.
 */
public enum BackendType {
    BOLT(ServiceType.NEO4J_BOLT),
    QUERY_API(ServiceType.NEO4J_QUERY_API),
    IN_MEMORY(ServiceType.IN_MEMORY);

    private final ServiceType serviceType;

    BackendType(ServiceType serviceType) {
        this.serviceType = serviceType;
    }

    public ServiceType getServiceType() {
        return serviceType;
    }
}
