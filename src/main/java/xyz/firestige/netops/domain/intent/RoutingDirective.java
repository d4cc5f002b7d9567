package xyz.firestige.netops.domain.intent;

import java.util.List;

/**
 * 动态路由配置
 *
 * @param processId OSPF 进程号；EIGRP 时为 AS 号
 * @param routerId  OSPF router-id，可为空
 */
public record RoutingDirective(RoutingProtocol protocol, Integer processId, String routerId,
                               List<NetworkStatement> networks) implements Directive {

    public RoutingDirective {
        networks = networks == null ? List.of() : List.copyOf(networks);
    }

    @Override
    public Stage stage() {
        return Stage.ROUTING;
    }

    @Override
    public String describe() {
        return "router " + (protocol != null ? protocol.name().toLowerCase() : "?") + " " + processId;
    }
}
