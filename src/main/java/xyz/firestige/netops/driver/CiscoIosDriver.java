package xyz.firestige.netops.driver;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.intent.InterfaceDirective;
import xyz.firestige.netops.domain.intent.NetworkStatement;
import xyz.firestige.netops.domain.intent.RoutingDirective;
import xyz.firestige.netops.domain.intent.RoutingProtocol;
import xyz.firestige.netops.domain.intent.Stage;
import xyz.firestige.netops.domain.intent.VlanDirective;
import xyz.firestige.netops.exception.CommandRejectedException;

/**
 * Cisco IOS 驱动（SSH 与 Telnet 共用同一套命令）
 */
public class CiscoIosDriver implements DeviceDriver {

    public static final String KIND_IOS = "cisco_ios";
    public static final String KIND_IOS_TELNET = "cisco_ios_telnet";

    private static final List<String> REJECTION_MARKERS = List.of(
            "% Invalid input",
            "% Incomplete command",
            "% Ambiguous command",
            "% Unrecognized command");

    @Override
    public Set<String> supportedKinds() {
        return Set.of(KIND_IOS, KIND_IOS_TELNET);
    }

    @Override
    public List<String> render(Directive directive) {
        if (directive instanceof InterfaceDirective) {
            return renderInterface((InterfaceDirective) directive);
        }
        if (directive instanceof RoutingDirective) {
            return renderRouting((RoutingDirective) directive);
        }
        if (directive instanceof VlanDirective) {
            return renderVlan((VlanDirective) directive);
        }
        throw new IllegalArgumentException("不支持的指令类型: " + directive.getClass().getSimpleName());
    }

    private List<String> renderInterface(InterfaceDirective d) {
        List<String> commands = new ArrayList<>();
        commands.add("interface " + d.name());
        commands.add("ip address " + d.address() + " " + d.mask());
        if (d.description() != null) {
            commands.add("description " + d.description());
        }
        commands.add(d.isEnabled() ? "no shutdown" : "shutdown");
        return commands;
    }

    private List<String> renderRouting(RoutingDirective d) {
        List<String> commands = new ArrayList<>();
        if (d.protocol() == RoutingProtocol.OSPF) {
            commands.add("router ospf " + d.processId());
            if (d.routerId() != null) {
                commands.add("router-id " + d.routerId());
            }
            for (NetworkStatement n : d.networks()) {
                commands.add("network " + n.network() + " " + n.wildcard() + " area " + n.area());
            }
        } else {
            commands.add("router eigrp " + d.processId());
            commands.add("no auto-summary");
            for (NetworkStatement n : d.networks()) {
                commands.add("network " + n.network() + " " + n.wildcard());
            }
        }
        return commands;
    }

    private List<String> renderVlan(VlanDirective d) {
        List<String> commands = new ArrayList<>();
        commands.add("interface " + d.subinterface());
        commands.add("encapsulation dot1Q " + d.vlanId());
        commands.add("ip address " + d.address() + " " + d.mask());
        if (d.description() != null) {
            commands.add("description " + d.description());
        }
        commands.add("no shutdown");
        return commands;
    }

    @Override
    public List<String> verificationCommands(Stage stage) {
        switch (stage) {
            case INTERFACES:
                return List.of("show ip interface brief");
            case ROUTING:
                return List.of("show ip route");
            case VLANS:
                return List.of("show ip interface brief | include \\.");
            default:
                return List.of();
        }
    }

    @Override
    public String saveCommand() {
        return "write memory";
    }

    @Override
    public String runningConfigCommand() {
        return "show running-config";
    }

    @Override
    public String versionCommand() {
        return "show version | include Version";
    }

    @Override
    public String hostnameCommand() {
        return "show run | include hostname";
    }

    @Override
    public void checkOutput(String command, String output) {
        if (output == null) {
            return;
        }
        for (String marker : REJECTION_MARKERS) {
            if (output.contains(marker)) {
                throw new CommandRejectedException(command, output);
            }
        }
    }

    /**
     * 去掉注释行（!）与 show running-config 的头部，其余按原样重新下发
     */
    @Override
    public List<String> restoreCommands(String snapshotContent) {
        List<String> commands = new ArrayList<>();
        for (String line : snapshotContent.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("!")
                    || trimmed.startsWith("Building configuration")
                    || trimmed.startsWith("Current configuration")
                    || trimmed.equals("end")) {
                continue;
            }
            commands.add(line.stripTrailing());
        }
        return commands;
    }
}
