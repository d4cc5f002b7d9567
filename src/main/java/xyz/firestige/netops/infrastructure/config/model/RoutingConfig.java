package xyz.firestige.netops.infrastructure.config.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * routing.yml
 * <pre>
 * ospf:
 *   enabled: true
 *   process_id: 1
 *   router_id_map:
 *     R1: 1.1.1.1
 *   areas:
 *     R1:
 *       - area: 0
 *         networks:
 *           - network: 10.0.12.0
 *             wildcard: 0.0.0.255
 * eigrp:
 *   enabled: false
 *   as_number: 100
 *   networks:
 *     R1:
 *       - network: 10.0.12.0
 *         wildcard: 0.0.0.255
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingConfig {

    private OspfConfig ospf;
    private EigrpConfig eigrp;

    public OspfConfig getOspf() {
        return ospf;
    }

    public void setOspf(OspfConfig ospf) {
        this.ospf = ospf;
    }

    public EigrpConfig getEigrp() {
        return eigrp;
    }

    public void setEigrp(EigrpConfig eigrp) {
        this.eigrp = eigrp;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OspfConfig {
        private boolean enabled;
        @JsonProperty("process_id")
        private Integer processId;
        @JsonProperty("router_id_map")
        private Map<String, String> routerIdMap;
        private Map<String, List<AreaConfig>> areas;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Integer getProcessId() { return processId; }
        public void setProcessId(Integer processId) { this.processId = processId; }

        public Map<String, String> getRouterIdMap() { return routerIdMap; }
        public void setRouterIdMap(Map<String, String> routerIdMap) { this.routerIdMap = routerIdMap; }

        public Map<String, List<AreaConfig>> getAreas() { return areas; }
        public void setAreas(Map<String, List<AreaConfig>> areas) { this.areas = areas; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AreaConfig {
        private String area;
        private List<NetworkConfig> networks;

        public String getArea() { return area; }
        public void setArea(String area) { this.area = area; }

        public List<NetworkConfig> getNetworks() { return networks; }
        public void setNetworks(List<NetworkConfig> networks) { this.networks = networks; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EigrpConfig {
        private boolean enabled;
        @JsonProperty("as_number")
        private Integer asNumber;
        private Map<String, List<NetworkConfig>> networks;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Integer getAsNumber() { return asNumber; }
        public void setAsNumber(Integer asNumber) { this.asNumber = asNumber; }

        public Map<String, List<NetworkConfig>> getNetworks() { return networks; }
        public void setNetworks(Map<String, List<NetworkConfig>> networks) { this.networks = networks; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NetworkConfig {
        private String network;
        private String wildcard;

        public String getNetwork() { return network; }
        public void setNetwork(String network) { this.network = network; }

        public String getWildcard() { return wildcard; }
        public void setWildcard(String wildcard) { this.wildcard = wildcard; }
    }
}
