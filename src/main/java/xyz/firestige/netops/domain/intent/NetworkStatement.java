package xyz.firestige.netops.domain.intent;

/**
 * 路由协议宣告的网段
 *
 * @param area OSPF 区域，EIGRP 为 null
 */
public record NetworkStatement(String network, String wildcard, String area) {

    public static NetworkStatement ospf(String network, String wildcard, String area) {
        return new NetworkStatement(network, wildcard, area);
    }

    public static NetworkStatement eigrp(String network, String wildcard) {
        return new NetworkStatement(network, wildcard, null);
    }
}
