package site.minikv.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KvBytes 单元测试
 *
 * 测试覆盖：
 * 1. 构造函数与工厂方法
 * 2. 不可变性（防御性拷贝）
 * 3. 比较操作（equals/equalsIgnoreCase/compareTo）
 * 4. 二进制安全
 */
@DisplayName("KvBytes 单元测试")
class KvBytesTest {

    @Nested
    @DisplayName("构造与工厂方法")
    class ConstructionTests {

        @Test
        @DisplayName("构造函数拷贝输入数组")
        void testConstructorCopiesInput() {
            final byte[] source = "value".getBytes(KvBytes.CHARSET);
            final KvBytes kv = new KvBytes(source);

            source[0] = 'X';

            assertEquals("value", kv.getString());
        }

        @Test
        @DisplayName("构造函数拒绝null")
        void testConstructorRejectsNull() {
            assertThrows(IllegalArgumentException.class, () -> new KvBytes(null));
        }

        @Test
        @DisplayName("wrapTrusted 不拷贝，null 透传")
        void testWrapTrusted() {
            final byte[] source = {1, 2, 3};
            final KvBytes kv = KvBytes.wrapTrusted(source);

            assertSame(source, kv.getBytesUnsafe());
            assertNull(KvBytes.wrapTrusted(null));
            assertSame(KvBytes.EMPTY, KvBytes.wrapTrusted(new byte[0]));
        }

        @Test
        @DisplayName("fromString 使用 UTF-8")
        void testFromString() {
            final KvBytes kv = KvBytes.fromString("键");

            assertEquals(3, kv.length());
            assertEquals("键", kv.getString());
            assertNull(KvBytes.fromString(null));
            assertTrue(KvBytes.fromString("").isEmpty());
        }

        @Test
        @DisplayName("getBytes 返回副本")
        void testGetBytesReturnsCopy() {
            final KvBytes kv = KvBytes.fromString("abc");
            final byte[] copy = kv.getBytes();

            copy[0] = 'z';

            assertEquals("abc", kv.getString());
        }
    }

    @Nested
    @DisplayName("比较操作")
    class ComparisonTests {

        @Test
        @DisplayName("equals 与 hashCode 基于内容")
        void testEqualsAndHashCode() {
            final KvBytes a = new KvBytes(new byte[]{0, (byte) 0xFF, '\r', '\n'});
            final KvBytes b = new KvBytes(new byte[]{0, (byte) 0xFF, '\r', '\n'});

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, KvBytes.fromString("other"));
            assertNotEquals(a, null);
        }

        @ParameterizedTest
        @ValueSource(strings = {"get", "GET", "Get", "gEt"})
        @DisplayName("equalsIgnoreCase 只忽略ASCII大小写")
        void testEqualsIgnoreCase(String name) {
            assertTrue(KvBytes.fromString("GET").equalsIgnoreCase(KvBytes.fromString(name)));
        }

        @Test
        @DisplayName("equalsIgnoreCase 长度不同或为null时不相等")
        void testEqualsIgnoreCaseMismatch() {
            final KvBytes get = KvBytes.fromString("GET");

            assertFalse(get.equalsIgnoreCase(KvBytes.fromString("GETX")));
            assertFalse(get.equalsIgnoreCase(KvBytes.fromString("SET")));
            assertFalse(get.equalsIgnoreCase(null));
        }

        @Test
        @DisplayName("toUpperAscii 保留非字母字节")
        void testToUpperAscii() {
            final KvBytes upper = KvBytes.fromString("del-1").toUpperAscii();
            final KvBytes already = KvBytes.fromString("DEL");

            assertEquals("DEL-1", upper.getString());
            assertSame(already, already.toUpperAscii());
        }

        @Test
        @DisplayName("compareTo 按无符号字节字典序")
        void testCompareToUnsigned() {
            final KvBytes low = new KvBytes(new byte[]{0x10});
            final KvBytes high = new KvBytes(new byte[]{(byte) 0x80});
            final KvBytes prefix = KvBytes.fromString("ab");
            final KvBytes longer = KvBytes.fromString("abc");

            assertTrue(low.compareTo(high) < 0);
            assertTrue(high.compareTo(low) > 0);
            assertTrue(prefix.compareTo(longer) < 0);
            assertEquals(0, prefix.compareTo(KvBytes.fromString("ab")));
        }

        @Test
        @DisplayName("排序结果稳定")
        void testSortOrder() {
            final List<KvBytes> keys = new ArrayList<>();
            keys.add(KvBytes.fromString("b"));
            keys.add(KvBytes.fromString("a"));
            keys.add(KvBytes.fromString("ab"));

            Collections.sort(keys);

            assertEquals("a", keys.get(0).getString());
            assertEquals("ab", keys.get(1).getString());
            assertEquals("b", keys.get(2).getString());
        }
    }

    @Test
    @DisplayName("toString 对二进制内容使用十六进制预览")
    void testToStringPreview() {
        final KvBytes kv = new KvBytes(new byte[]{'a', 0});

        assertEquals("KvBytes[length=2, preview='a\\x00']", kv.toString());
    }
}
