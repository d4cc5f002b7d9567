package xyz.firestige.netops.infrastructure.config.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * interfaces.yml 中一台设备的条目（顶层是设备名 → 本类）
 * <pre>
 * R1:
 *   interfaces:
 *     - name: GigabitEthernet0/0
 *       ip_address: 10.0.12.1
 *       subnet_mask: 255.255.255.0
 *       description: Link to R2
 *       enabled: true
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InterfacesConfig {

    private List<InterfaceConfig> interfaces;

    public List<InterfaceConfig> getInterfaces() {
        return interfaces;
    }

    public void setInterfaces(List<InterfaceConfig> interfaces) {
        this.interfaces = interfaces;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InterfaceConfig {
        private String name;
        @JsonProperty("ip_address")
        private String ipAddress;
        @JsonProperty("subnet_mask")
        private String subnetMask;
        private String description;
        private Boolean enabled;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getIpAddress() { return ipAddress; }
        public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }

        public String getSubnetMask() { return subnetMask; }
        public void setSubnetMask(String subnetMask) { this.subnetMask = subnetMask; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public Boolean getEnabled() { return enabled; }
        public void setEnabled(Boolean enabled) { this.enabled = enabled; }
    }
}
