package xyz.firestige.netops.session;

import java.util.List;

/**
 * 与单台设备的远程命令行会话
 * <p>
 * 具体传输（SSH / Telnet）由外部实现提供。所有方法都可能失败：
 * 传输问题抛出 {@link xyz.firestige.netops.exception.ConnectionException}，
 * 其余异常按系统错误处理。
 */
public interface DeviceSession extends AutoCloseable {

    /**
     * 在特权模式下执行一条命令并返回输出
     */
    String execute(String command);

    /**
     * 进入配置模式依次下发命令，返回完整回显
     */
    String executeConfig(List<String> commands);

    @Override
    void close();
}
