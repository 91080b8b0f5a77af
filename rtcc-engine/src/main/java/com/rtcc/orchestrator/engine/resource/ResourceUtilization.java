package com.rtcc.orchestrator.engine.resource;

/**
 * Per-type counts. Utilization is the held share of the resources that are in service.
 */
public record ResourceUtilization(
    int total,
    int available,
    int allocated,
    int inUse,
    int outOfService,
    double utilizationRate
) {
    static ResourceUtilization of(int total, int available, int allocated, int inUse, int outOfService) {
        int inService = total - outOfService;
        double rate = inService == 0 ? 0.0 : (double) (allocated + inUse) / inService;
        return new ResourceUtilization(total, available, allocated, inUse, outOfService, rate);
    }
}
