package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.Test;
import site.minikv.protocol.*;

import static org.junit.jupiter.api.Assertions.*;

public class RespEncoderTest {

    private static String encode(Resp resp) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        assertTrue(channel.writeOutbound(resp));

        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(CharsetUtil.ISO_8859_1);
        } finally {
            buf.release();
            channel.finish();
        }
    }

    @Test
    public void testEncodeSimpleString() {
        assertEquals("+OK\r\n", encode(SimpleString.OK));
    }

    @Test
    public void testEncodeError() {
        assertEquals("-wrong number of arguments for 'get'\r\n",
                encode(new Errors("wrong number of arguments for 'get'")));
    }

    @Test
    public void testEncodeInteger() {
        assertEquals(":1000\r\n", encode(RespInteger.valueOf(1000)));
    }

    @Test
    public void testEncodeBulkString() {
        assertEquals("$5\r\nhello\r\n", encode(BulkString.fromString("hello")));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
    }

    @Test
    public void testEncodeArray() {
        RespArray array = new RespArray(BulkString.fromString("hello"), BulkString.fromString("world"));

        assertEquals("*2\r\n$5\r\nhello\r\n$5\r\nworld\r\n", encode(array));
    }

    @Test
    public void testEncodeNull() {
        assertEquals("*-1\r\n", encode(RespNull.INSTANCE));
    }

    @Test
    public void testEncodeLargeBulkString() {
        byte[] payload = new byte[100_000];
        payload[99_999] = 'z';

        String encoded = encode(BulkString.create(payload));

        assertTrue(encoded.startsWith("$100000\r\n"));
        assertEquals(9 + 100_000 + 2, encoded.length());
        assertTrue(encoded.endsWith("z\r\n"));
    }

    @Test
    public void testRepliesKeepWriteOrder() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        channel.writeOutbound(SimpleString.OK, RespInteger.ONE, BulkString.NULL);

        StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(CharsetUtil.ISO_8859_1));
            buf.release();
        }

        assertEquals("+OK\r\n:1\r\n$-1\r\n", sb.toString());
        channel.finish();
    }
}
