package xyz.firestige.netops.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import xyz.firestige.netops.domain.device.CredentialRef;
import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.device.Inventory;
import xyz.firestige.netops.domain.intent.ConfigIntent;
import xyz.firestige.netops.domain.intent.IntentSet;
import xyz.firestige.netops.domain.intent.InterfaceDirective;
import xyz.firestige.netops.domain.intent.NetworkStatement;
import xyz.firestige.netops.domain.intent.RoutingDirective;
import xyz.firestige.netops.domain.intent.RoutingProtocol;
import xyz.firestige.netops.domain.intent.VlanDirective;
import xyz.firestige.netops.infrastructure.config.model.InterfacesConfig;
import xyz.firestige.netops.infrastructure.config.model.InventoryConfig;
import xyz.firestige.netops.infrastructure.config.model.RoutingConfig;
import xyz.firestige.netops.infrastructure.config.model.VlansConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML 配置加载器
 *
 * 职责：
 * 1. 读取 inventory.yml / interfaces.yml / routing.yml / vlans.yml
 * 2. 转换为 Inventory 与 IntentSet
 *
 * 只做语法层面的转换，设备引用、必填字段、地址格式等交给校验链。
 * 除 inventory.yml 外其余文件都是可选的。
 */
public class FleetConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(FleetConfigLoader.class);

    public static final String INVENTORY_FILE = "inventory.yml";
    public static final String INTERFACES_FILE = "interfaces.yml";
    public static final String ROUTING_FILE = "routing.yml";
    public static final String VLANS_FILE = "vlans.yml";

    private final ObjectMapper yamlMapper;

    public FleetConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * 从文件系统目录加载
     */
    public FleetDefinition load(Path directory) {
        String base = directory.toString();
        return load(new FileSystemResource(base.endsWith("/") ? base : base + "/"));
    }

    /**
     * 从 classpath 目录加载，例如 {@code "fleet/"}
     */
    public FleetDefinition loadFromClasspath(String location) {
        return load(new ClassPathResource(location.endsWith("/") ? location : location + "/"));
    }

    public FleetDefinition load(Resource directory) {
        try {
            log.info("Loading fleet configuration from {}", directory.getDescription());
            InventoryConfig inventoryConfig = read(directory, INVENTORY_FILE, new TypeReference<InventoryConfig>() { });
            if (inventoryConfig == null) {
                throw new IllegalStateException("Missing " + INVENTORY_FILE + " in " + directory.getDescription());
            }
            Map<String, InterfacesConfig> interfaces = read(directory, INTERFACES_FILE,
                    new TypeReference<Map<String, InterfacesConfig>>() { });
            RoutingConfig routing = read(directory, ROUTING_FILE, new TypeReference<RoutingConfig>() { });
            VlansConfig vlans = read(directory, VLANS_FILE, new TypeReference<VlansConfig>() { });

            Inventory inventory = toInventory(inventoryConfig);
            IntentSet intents = toIntents(inventory, interfaces, routing, vlans);
            log.info("Fleet configuration loaded: {} devices, {} intents", inventory.size(), intents.size());
            return new FleetDefinition(inventory, intents);
        } catch (IOException e) {
            log.error("Failed to load fleet configuration", e);
            throw new IllegalStateException("Cannot load fleet configuration", e);
        }
    }

    private <T> T read(Resource directory, String file, TypeReference<T> type) throws IOException {
        Resource resource = directory.createRelative(file);
        if (!resource.exists()) {
            log.debug("{} not found, skipped", file);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return yamlMapper.readValue(in, type);
        }
    }

    private Inventory toInventory(InventoryConfig config) {
        List<Device> devices = new ArrayList<>();
        if (config.getRouters() != null) {
            for (InventoryConfig.RouterConfig router : config.getRouters()) {
                Device.Builder builder = Device.builder(router.getName())
                        .address(router.getIp())
                        .kind(router.getDeviceType());
                if (router.getPort() != null) {
                    builder.port(router.getPort());
                }
                if (router.getCredential() != null) {
                    builder.credentialRef(CredentialRef.of(router.getCredential()));
                }
                devices.add(builder.build());
            }
        }
        return Inventory.of(devices);
    }

    /**
     * 每台设备一个 ConfigIntent：清单中的设备在前，其余按文件中出现的顺序追加
     */
    private IntentSet toIntents(Inventory inventory, Map<String, InterfacesConfig> interfaces,
                                RoutingConfig routing, VlansConfig vlans) {
        Map<String, ConfigIntent.Builder> builders = new LinkedHashMap<>();

        if (interfaces != null) {
            interfaces.forEach((device, cfg) -> {
                if (cfg != null && cfg.getInterfaces() != null) {
                    for (InterfacesConfig.InterfaceConfig i : cfg.getInterfaces()) {
                        builderOf(builders, device).add(new InterfaceDirective(
                                i.getName(), i.getIpAddress(), i.getSubnetMask(), i.getDescription(), i.getEnabled()));
                    }
                }
            });
        }

        if (routing != null && routing.getOspf() != null && routing.getOspf().isEnabled()) {
            RoutingConfig.OspfConfig ospf = routing.getOspf();
            Set<String> devices = new LinkedHashSet<>();
            if (ospf.getAreas() != null) {
                devices.addAll(ospf.getAreas().keySet());
            }
            if (ospf.getRouterIdMap() != null) {
                devices.addAll(ospf.getRouterIdMap().keySet());
            }
            for (String device : devices) {
                List<NetworkStatement> networks = new ArrayList<>();
                List<RoutingConfig.AreaConfig> areas = ospf.getAreas() == null ? null : ospf.getAreas().get(device);
                if (areas != null) {
                    for (RoutingConfig.AreaConfig area : areas) {
                        if (area.getNetworks() != null) {
                            for (RoutingConfig.NetworkConfig n : area.getNetworks()) {
                                networks.add(NetworkStatement.ospf(n.getNetwork(), n.getWildcard(), area.getArea()));
                            }
                        }
                    }
                }
                String routerId = ospf.getRouterIdMap() == null ? null : ospf.getRouterIdMap().get(device);
                builderOf(builders, device).add(new RoutingDirective(RoutingProtocol.OSPF, ospf.getProcessId(), routerId, networks));
            }
        }

        if (routing != null && routing.getEigrp() != null && routing.getEigrp().isEnabled()
                && routing.getEigrp().getNetworks() != null) {
            RoutingConfig.EigrpConfig eigrp = routing.getEigrp();
            eigrp.getNetworks().forEach((device, list) -> {
                List<NetworkStatement> networks = new ArrayList<>();
                if (list != null) {
                    for (RoutingConfig.NetworkConfig n : list) {
                        networks.add(NetworkStatement.eigrp(n.getNetwork(), n.getWildcard()));
                    }
                }
                builderOf(builders, device).add(new RoutingDirective(RoutingProtocol.EIGRP, eigrp.getAsNumber(), null, networks));
            });
        }

        if (vlans != null && vlans.getRouterSubinterfaces() != null) {
            vlans.getRouterSubinterfaces().forEach((device, list) -> {
                if (list != null) {
                    for (VlansConfig.SubinterfaceConfig s : list) {
                        builderOf(builders, device).add(new VlanDirective(
                                s.getVlan(), s.getSubinterface(), s.getIpAddress(), s.getSubnetMask(), s.getDescription()));
                    }
                }
            });
        }

        List<ConfigIntent> intents = new ArrayList<>();
        for (Device device : inventory.devices()) {
            ConfigIntent.Builder builder = builders.remove(device.getName());
            if (builder != null) {
                intents.add(builder.build());
            }
        }
        // 清单中不存在的设备也保留，由 DeviceReferenceValidator 报告
        builders.values().forEach(b -> intents.add(b.build()));
        return IntentSet.of(intents);
    }

    private static ConfigIntent.Builder builderOf(Map<String, ConfigIntent.Builder> builders, String device) {
        return builders.computeIfAbsent(device, ConfigIntent::forDevice);
    }
}
