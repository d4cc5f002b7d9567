package xyz.firestige.netops.infrastructure.config.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * vlans.yml
 * <pre>
 * vlans:
 *   - id: 10
 *     name: Sales
 *     description: Sales department
 * router_subinterfaces:
 *   R1:
 *     - interface: GigabitEthernet0/1.10
 *       vlan: 10
 *       ip_address: 192.168.10.1
 *       subnet_mask: 255.255.255.0
 *       description: Sales gateway
 * </pre>
 * vlans 段只用于展示，下发以 router_subinterfaces 为准。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VlansConfig {

    private List<VlanDefinition> vlans;
    @JsonProperty("router_subinterfaces")
    private Map<String, List<SubinterfaceConfig>> routerSubinterfaces;

    public List<VlanDefinition> getVlans() {
        return vlans;
    }

    public void setVlans(List<VlanDefinition> vlans) {
        this.vlans = vlans;
    }

    public Map<String, List<SubinterfaceConfig>> getRouterSubinterfaces() {
        return routerSubinterfaces;
    }

    public void setRouterSubinterfaces(Map<String, List<SubinterfaceConfig>> routerSubinterfaces) {
        this.routerSubinterfaces = routerSubinterfaces;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VlanDefinition {
        private Integer id;
        private String name;
        private String description;

        public Integer getId() { return id; }
        public void setId(Integer id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubinterfaceConfig {
        @JsonProperty("interface")
        private String subinterface;
        private Integer vlan;
        @JsonProperty("ip_address")
        private String ipAddress;
        @JsonProperty("subnet_mask")
        private String subnetMask;
        private String description;

        public String getSubinterface() { return subinterface; }
        public void setSubinterface(String subinterface) { this.subinterface = subinterface; }

        public Integer getVlan() { return vlan; }
        public void setVlan(Integer vlan) { this.vlan = vlan; }

        public String getIpAddress() { return ipAddress; }
        public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }

        public String getSubnetMask() { return subnetMask; }
        public void setSubnetMask(String subnetMask) { this.subnetMask = subnetMask; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }
}
