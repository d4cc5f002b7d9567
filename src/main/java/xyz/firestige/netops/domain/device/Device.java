package xyz.firestige.netops.domain.device;

import java.util.Objects;

/**
 * 被管理的网络设备（值对象）
 * <p>
 * 每次运行从 Inventory 加载一次，运行期间不可变。
 * {@code kind} 是设备类型标签（如 cisco_ios），用于在构建阶段动作时选择驱动。
 */
public final class Device {

    public static final int DEFAULT_PORT = 22;

    private final String name;
    private final String address;
    private final int port;
    private final String kind;
    private final CredentialRef credentialRef;

    private Device(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("device name 不能为空");
        }
        this.name = builder.name;
        this.address = builder.address;
        this.port = builder.port;
        this.kind = builder.kind;
        this.credentialRef = builder.credentialRef;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public String getKind() {
        return kind;
    }

    public CredentialRef getCredentialRef() {
        return credentialRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Device device = (Device) o;
        return port == device.port &&
               name.equals(device.name) &&
               Objects.equals(address, device.address) &&
               Objects.equals(kind, device.kind) &&
               Objects.equals(credentialRef, device.credentialRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, address, port, kind, credentialRef);
    }

    @Override
    public String toString() {
        return String.format("Device[%s %s:%d kind=%s]", name, address, port, kind);
    }

    public static final class Builder {
        private final String name;
        private String address;
        private int port = DEFAULT_PORT;
        private String kind;
        private CredentialRef credentialRef;

        private Builder(String name) {
            this.name = name;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder credentialRef(CredentialRef credentialRef) {
            this.credentialRef = credentialRef;
            return this;
        }

        public Device build() {
            return new Device(this);
        }
    }
}
