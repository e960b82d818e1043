package site.minikv.protocol;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 解码器的大小限制，防止恶意的长度字段导致内存无限增长。
 *
 * @since 1.0.0
 */
@Getter
@Builder
@ToString
public final class CodecLimits {

    /** 批量字符串的默认最大长度：512MB */
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;

    /** 数组的默认最大元素个数 */
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;

    /** 长度行的默认最大字节数：64KB */
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    /** 长度行允许配置的上限：1MB */
    public static final int MAX_LINE_LENGTH_LIMIT = 1024 * 1024;

    /** 单个请求帧的默认最大字节数：1GB */
    public static final int DEFAULT_MAX_REQUEST_LENGTH = 1024 * 1024 * 1024;

    /** 单个批量字符串的最大长度 */
    @Builder.Default
    private final int maxBulkLength = DEFAULT_MAX_BULK_LENGTH;

    /** 单个请求的最大元素个数 */
    @Builder.Default
    private final int maxArrayLength = DEFAULT_MAX_ARRAY_LENGTH;

    /** "*N" 或 "$N" 行在找到CRLF之前允许的最大字节数 */
    @Builder.Default
    private final int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

    /** 一个请求帧（包括尚未到齐的帧）在缓冲区中最多占用的字节数 */
    @Builder.Default
    private final int maxRequestLength = DEFAULT_MAX_REQUEST_LENGTH;

    /**
     * 默认限制
     *
     * @return 默认配置的实例
     */
    public static CodecLimits defaults() {
        return CodecLimits.builder().build();
    }

    /**
     * 验证限制的合法性
     *
     * @throws IllegalArgumentException 如果任一限制不合法
     */
    public void validate() {
        // 负载之后还要读两个字节的CRLF，长度加2不能溢出
        if (maxBulkLength <= 0 || maxBulkLength > Integer.MAX_VALUE - 2) {
            throw new IllegalArgumentException("maxBulkLength必须在1到" + (Integer.MAX_VALUE - 2) + "之间");
        }
        if (maxArrayLength <= 0) {
            throw new IllegalArgumentException("maxArrayLength必须大于0");
        }
        if (maxLineLength < 3 || maxLineLength > MAX_LINE_LENGTH_LIMIT) {
            throw new IllegalArgumentException("maxLineLength必须在3到" + MAX_LINE_LENGTH_LIMIT + "之间");
        }
        if (maxRequestLength <= 0) {
            throw new IllegalArgumentException("maxRequestLength必须大于0");
        }
    }
}
