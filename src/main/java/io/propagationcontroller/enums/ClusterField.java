package io.propagationcontroller.enums;

import io.propagationcontroller.models.ClusterDescriptor;

import java.util.function.Function;

/**
 * Cluster fields that field selectors and spread constraints can refer to.
 * 
 * CLUSTER resolves to the cluster name, so spreading by it makes every cluster its own unit.
 */
public enum ClusterField {
    CLUSTER("cluster", ClusterDescriptor::getName),
    PROVIDER("provider", ClusterDescriptor::getProvider),
    REGION("region", ClusterDescriptor::getRegion),
    ZONE("zone", ClusterDescriptor::getZone);
    
    private final String value;
    private final Function<ClusterDescriptor, String> extractor;
    
    ClusterField(String value, Function<ClusterDescriptor, String> extractor) {
        this.value = value;
        this.extractor = extractor;
    }
    
    public String getValue() {
        return value;
    }
    
    /**
     * Read this field from a cluster.
     * 
     * @return the field value, or null when the cluster does not report it
     */
    public String extract(ClusterDescriptor cluster) {
        return extractor.apply(cluster);
    }
    
    /**
     * @return the field for a key, or null when the key is not a known cluster field
     */
    public static ClusterField fromString(String value) {
        if (value == null) return null;
        
        switch (value.trim().toLowerCase()) {
            case "cluster":
                return CLUSTER;
            case "provider":
                return PROVIDER;
            case "region":
                return REGION;
            case "zone":
                return ZONE;
            default:
                return null;
        }
    }
}
