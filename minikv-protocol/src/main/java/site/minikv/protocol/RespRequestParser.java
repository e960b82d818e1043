package site.minikv.protocol;

import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.List;

/**
 * 客户端请求的增量解析器
 *
 * <p>请求必须是由非空BulkString组成的数组，例如
 * "*2\r\n$3\r\nGET\r\n$3\r\nkey\r\n"。解析结果分三种：
 * <ul>
 *     <li>返回 {@link RespArray} - 缓冲区中已有一个完整帧，恰好消费该帧的字节</li>
 *     <li>返回 null - 数据不完整，读索引回滚到帧起点，等待更多数据</li>
 *     <li>抛出 {@link ProtocolException} - 帧格式错误，连接无法恢复</li>
 * </ul>
 *
 * <p>批量字符串的结束位置只由声明的长度决定，负载中的CRLF是普通数据。
 * 负载之后的两个字节不是CRLF时按数据不完整处理。
 * 声明的长度超过 {@link CodecLimits#getMaxBulkLength()} 时立即报错，
 * 不会等待这么多字节到达；一个帧占用的字节数超过
 * {@link CodecLimits#getMaxRequestLength()} 时同样报错。
 *
 * <p>解析分两步：先只扫描帧头和长度行，确认整个帧已经到齐，再一次性拷贝所有负载。
 * 扫描进度以相对帧起点的偏移保存，下次数据到达时从断点继续，
 * 已确认的元素不会被重复扫描或拷贝。因此每个连接需要一个独立的实例，
 * 并且调用方必须保证每次调用时读索引都位于同一个帧的起点。
 *
 * @since 1.0.0
 */
public class RespRequestParser {

    /** 数据不完整的返回值 */
    private static final int INCOMPLETE = -1;

    private final CodecLimits limits;

    /** 当前帧声明的元素个数，0表示帧头还未扫描 */
    private int expectedElements;

    /** 已确认完整的元素个数 */
    private int scannedElements;

    /** 已确认部分相对帧起点的字节数 */
    private int scannedBytes;

    public RespRequestParser(final CodecLimits limits) {
        limits.validate();
        this.limits = limits;
    }

    public RespRequestParser() {
        this(CodecLimits.defaults());
    }

    /**
     * 尝试从缓冲区解析一个完整的请求
     *
     * @param in 输入缓冲区
     * @return 解析出的请求；数据不完整时返回null
     * @throws ProtocolException 帧格式错误时抛出，读索引保持在帧起点
     */
    public RespArray parse(final ByteBuf in) {
        if (!in.isReadable()) {
            return null;
        }

        final int frameStart = in.readerIndex();
        try {
            final int frameLength = scanFrame(in, frameStart);
            if (frameLength == INCOMPLETE) {
                if (in.readableBytes() > limits.getMaxRequestLength()) {
                    throw new ProtocolException("length too large");
                }
                return null;
            }
            final RespArray request = readFrame(in);
            reset();
            return request;
        } catch (ProtocolException e) {
            reset();
            in.readerIndex(frameStart);
            throw e;
        }
    }

    /**
     * 丢弃保存的扫描进度
     */
    public void reset() {
        expectedElements = 0;
        scannedElements = 0;
        scannedBytes = 0;
    }

    /**
     * 已确认部分相对帧起点的字节数
     */
    int scannedBytes() {
        return scannedBytes;
    }

    /**
     * 从上次的断点继续扫描，不移动读索引，也不拷贝负载
     *
     * @return 完整帧的字节数；数据不完整时返回 {@link #INCOMPLETE}
     */
    private int scanFrame(final ByteBuf in, final int frameStart) {
        if (expectedElements == 0) {
            final byte type = in.getByte(frameStart);
            if (type != '*') {
                throw new ProtocolException("expected array, got " + describe(type));
            }
            final int cr = findLineEnd(in, frameStart + 1);
            if (cr == INCOMPLETE) {
                return INCOMPLETE;
            }
            final long count = parseDecimal(in, frameStart + 1, cr);
            if (count <= 0) {
                throw new ProtocolException("empty request");
            }
            if (count > limits.getMaxArrayLength()) {
                throw new ProtocolException("too many elements");
            }
            expectedElements = (int) count;
            scannedBytes = cr + 2 - frameStart;
        }

        while (scannedElements < expectedElements) {
            final int elementStart = frameStart + scannedBytes;
            if (elementStart >= in.writerIndex()) {
                return INCOMPLETE;
            }
            final byte type = in.getByte(elementStart);
            if (type != '$') {
                throw new ProtocolException("expected bulk string, got " + describe(type));
            }
            final int cr = findLineEnd(in, elementStart + 1);
            if (cr == INCOMPLETE) {
                return INCOMPLETE;
            }
            final long length = parseDecimal(in, elementStart + 1, cr);
            if (length < 0) {
                throw new ProtocolException("negative bulk length");
            }
            if (length > limits.getMaxBulkLength()) {
                throw new ProtocolException("length too large");
            }

            // 负载加上结尾的CRLF
            final long elementEnd = cr + 2L + length + 2L;
            if (elementEnd - frameStart > limits.getMaxRequestLength()) {
                throw new ProtocolException("length too large");
            }
            if (elementEnd > in.writerIndex()) {
                return INCOMPLETE;
            }
            if (in.getByte((int) elementEnd - 2) != '\r' || in.getByte((int) elementEnd - 1) != '\n') {
                return INCOMPLETE;
            }

            scannedElements++;
            scannedBytes = (int) (elementEnd - frameStart);
        }
        return scannedBytes;
    }

    /**
     * 读取一个已确认完整的帧，并将读索引移到帧尾
     */
    private RespArray readFrame(final ByteBuf in) {
        in.skipBytes(1);
        skipLine(in);

        final List<Resp> elements = new ArrayList<>(expectedElements);
        for (int i = 0; i < expectedElements; i++) {
            in.skipBytes(1);
            final int payloadLength = (int) skipLine(in);
            final byte[] content = new byte[payloadLength];
            in.readBytes(content);
            in.skipBytes(2);
            // 新分配的数组只归这个BulkString所有，可以零拷贝包装
            elements.add(BulkString.wrapTrusted(content));
        }
        return RespArray.valueOf(elements);
    }

    /**
     * 读取一个已确认合法的长度行
     *
     * @return 行中的十进制长度
     */
    private static long skipLine(final ByteBuf in) {
        final int lineStart = in.readerIndex();
        final int cr = in.indexOf(lineStart, in.writerIndex(), (byte) '\r');
        final long value = parseDecimal(in, lineStart, cr);
        in.readerIndex(cr + 2);
        return value;
    }

    /**
     * 查找"*"或"$"之后长度行的CR位置
     *
     * @param in        输入缓冲区
     * @param lineStart 数字的第一个字节
     * @return CR的下标；数据不完整时返回 {@link #INCOMPLETE}
     */
    private int findLineEnd(final ByteBuf in, final int lineStart) {
        final int searchEnd = (int) Math.min(in.writerIndex(), (long) lineStart + limits.getMaxLineLength());
        final int cr = lineStart < searchEnd ? in.indexOf(lineStart, searchEnd, (byte) '\r') : -1;

        if (cr < 0) {
            if (in.writerIndex() - lineStart >= limits.getMaxLineLength()) {
                throw new ProtocolException("line too long");
            }
            return INCOMPLETE;
        }
        if (cr + 1 >= in.writerIndex()) {
            return INCOMPLETE;
        }
        if (in.getByte(cr + 1) != '\n') {
            throw new ProtocolException("expected CRLF after length");
        }
        return cr;
    }

    private static long parseDecimal(final ByteBuf in, final int start, final int end) {
        int index = start;
        final boolean negative = index < end && in.getByte(index) == '-';
        if (negative) {
            index++;
        }
        if (index == end) {
            throw new ProtocolException("invalid length");
        }

        long value = 0;
        for (; index < end; index++) {
            final byte b = in.getByte(index);
            if (b < '0' || b > '9') {
                throw new ProtocolException("invalid length");
            }
            final int digit = b - '0';
            if (value > (Long.MAX_VALUE - digit) / 10) {
                throw new ProtocolException("invalid length");
            }
            value = value * 10 + digit;
        }
        return negative ? -value : value;
    }

    private static String describe(final byte b) {
        if (b >= 32 && b <= 126) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02x", b & 0xFF);
    }
}
