package xyz.firestige.netops.session;

import xyz.firestige.netops.domain.device.Device;

/**
 * 会话工厂：根据设备身份建立会话
 * <p>
 * 凭据由实现方通过 {@link Device#getCredentialRef()} 自行解析。
 */
@FunctionalInterface
public interface DeviceSessionFactory {

    /**
     * @throws xyz.firestige.netops.exception.ConnectionException 连接或认证失败
     */
    DeviceSession connect(Device device);
}
