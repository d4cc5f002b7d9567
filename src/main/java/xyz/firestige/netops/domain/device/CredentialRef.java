package xyz.firestige.netops.domain.device;

import java.util.Objects;

/**
 * 凭据引用（不透明句柄）
 * <p>
 * 只保存凭据在外部存储中的名称，真正的口令由会话工厂在建立连接时解析，
 * 引擎内部从不持有明文。
 */
public final class CredentialRef {

    private final String handle;

    private CredentialRef(String handle) {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("credential handle 不能为空");
        }
        this.handle = handle;
    }

    public static CredentialRef of(String handle) {
        return new CredentialRef(handle);
    }

    public String getHandle() {
        return handle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return handle.equals(((CredentialRef) o).handle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handle);
    }

    @Override
    public String toString() {
        return "CredentialRef[" + handle + "]";
    }
}
