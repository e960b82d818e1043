package site.minikv.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变的二进制安全字节串，用作键、值以及命令名。
 *
 * <p>本类为字节数组提供不可变封装：
 * <ul>
 *   <li>内容相等：equals/hashCode 比较字节内容，而非引用
 *   <li>哈希值缓存：构造时预计算，提升 HashMap 查找性能
 *   <li>字典序：compareTo 按无符号字节逐位比较，作为固定的加锁顺序
 *   <li>零拷贝接口：为受信任场景（如解码器新分配的数组）提供 wrapTrusted
 * </ul>
 *
 * <p>线程安全性：本类不可变，可在多个连接之间自由共享。
 *
 * @since 1.0.0
 */
public final class KvBytes implements Comparable<KvBytes> {

    /**
     * 字符串编码解码使用的字符集。
     */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /**
     * 预分配的空字节串实例。
     */
    public static final KvBytes EMPTY = new KvBytes(new byte[0], true);

    /**
     * 自动字符串缓存的最大长度。
     */
    private static final int MAX_CACHED_STRING_SIZE = 128;

    /**
     * 存储的字节数组（不可变）。
     */
    private final byte[] bytes;

    /**
     * 预计算的哈希值。
     */
    private final int hashCode;

    /**
     * 延迟初始化的字符串值。
     */
    private volatile String stringValue;

    /**
     * 创建字节串实例，执行防御性拷贝以确保不可变性。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public KvBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private KvBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    // ========== 工厂方法 ==========

    /**
     * 创建零拷贝实例。
     *
     * <p><b>警告</b>：调用者必须保证参数数组此后不再被任何人修改！
     *
     * @param trustedBytes 受信任的字节数组
     * @return 字节串实例，如果输入为null则返回null
     */
    public static KvBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        if (trustedBytes.length == 0) {
            return EMPTY;
        }
        return new KvBytes(trustedBytes, true);
    }

    /**
     * 从UTF-8字符串创建实例。
     *
     * @param str 源字符串
     * @return 字节串实例，如果输入为null则返回null
     */
    public static KvBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final KvBytes kvBytes = new KvBytes(str.getBytes(CHARSET), true);
        if (str.length() <= MAX_CACHED_STRING_SIZE) {
            kvBytes.stringValue = str;
        }
        return kvBytes;
    }

    // ========== 核心方法 ==========

    /**
     * 获取底层字节数组的副本。
     *
     * @return 字节数组的副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层字节数组的直接引用，用于编码等只读场景。
     *
     * <p><strong>警告：</strong>调用者不得修改返回的数组！
     *
     * @return 字节数组的直接引用
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 获取UTF-8字符串表示，非法字节序列会被替换。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * ASCII 大小写不敏感的字节比较，用于命令名匹配。
     *
     * @param other 另一个字节串
     * @return 是否相等（忽略ASCII大小写）
     */
    public boolean equalsIgnoreCase(final KvBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLowerAscii(bytes[i]) != toLowerAscii(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * 转换为ASCII大写形式，非字母字节保持不变。
     *
     * @return 大写字节串，如果已经是大写则返回自身
     */
    public KvBytes toUpperAscii() {
        byte[] upper = null;
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            if (b >= 'a' && b <= 'z') {
                if (upper == null) {
                    upper = bytes.clone();
                }
                upper[i] = (byte) (b - 32);
            }
        }
        return upper == null ? this : new KvBytes(upper, true);
    }

    private static byte toLowerAscii(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    /**
     * 获取字节数组的长度
     *
     * @return 字节数组的长度
     */
    public int length() {
        return bytes.length;
    }

    /**
     * 检查是否为空
     *
     * @return 长度为0时返回true
     */
    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final KvBytes other = (KvBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 按无符号字节的字典序比较；若一个是另一个的前缀，较短者在前。
     *
     * @param other 要比较的字节串
     * @return 负数、0或正数
     */
    @Override
    public int compareTo(final KvBytes other) {
        if (this == other) {
            return 0;
        }
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("KvBytes[length=").append(bytes.length);

        // 只预览前16个字节，不可打印字符以十六进制显示
        if (bytes.length <= 32) {
            sb.append(", preview='");
            for (int i = 0; i < Math.min(bytes.length, 16); i++) {
                final byte b = bytes[i];
                if (b >= 32 && b <= 126) {
                    sb.append((char) b);
                } else {
                    sb.append("\\x").append(String.format("%02x", b & 0xFF));
                }
            }
            if (bytes.length > 16) {
                sb.append("...");
            }
            sb.append("'");
        } else {
            sb.append(", type=binary");
        }
        sb.append("]");
        return sb.toString();
    }
}
