package xyz.firestige.netops.validation.validator;

/**
 * IPv4 地址、掩码与反掩码的格式检查
 */
final class Ipv4 {

    private Ipv4() {
    }

    static boolean isAddress(String value) {
        return toBits(value) != null;
    }

    /**
     * 掩码：高位连续的 1
     */
    static boolean isMask(String value) {
        Long bits = toBits(value);
        if (bits == null) {
            return false;
        }
        long inverted = ~bits & 0xFFFFFFFFL;
        return (inverted & (inverted + 1)) == 0;
    }

    /**
     * 反掩码：低位连续的 1
     */
    static boolean isWildcard(String value) {
        Long bits = toBits(value);
        return bits != null && (bits & (bits + 1)) == 0;
    }

    private static Long toBits(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.trim().split("\\.", -1);
        if (parts.length != 4) {
            return null;
        }
        long bits = 0;
        try {
            for (String part : parts) {
                if (part.isEmpty() || part.length() > 3) {
                    return null;
                }
                int num = Integer.parseInt(part);
                if (num < 0 || num > 255) {
                    return null;
                }
                bits = (bits << 8) | num;
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return bits;
    }
}
