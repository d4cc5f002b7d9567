package xyz.firestige.netops.domain.intent;

public enum RoutingProtocol {
    OSPF,
    EIGRP
}
