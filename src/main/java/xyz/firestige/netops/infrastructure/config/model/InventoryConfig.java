package xyz.firestige.netops.infrastructure.config.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * inventory.yml
 * <pre>
 * routers:
 *   - name: R1
 *     ip: 192.168.1.1
 *     device_type: cisco_ios
 *     port: 22
 *     credential: lab-default
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InventoryConfig {

    private List<RouterConfig> routers;

    public List<RouterConfig> getRouters() {
        return routers;
    }

    public void setRouters(List<RouterConfig> routers) {
        this.routers = routers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RouterConfig {
        private String name;
        private String ip;
        @JsonProperty("device_type")
        private String deviceType;
        private Integer port;
        private String credential;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getIp() { return ip; }
        public void setIp(String ip) { this.ip = ip; }

        public String getDeviceType() { return deviceType; }
        public void setDeviceType(String deviceType) { this.deviceType = deviceType; }

        public Integer getPort() { return port; }
        public void setPort(Integer port) { this.port = port; }

        public String getCredential() { return credential; }
        public void setCredential(String credential) { this.credential = credential; }
    }
}
