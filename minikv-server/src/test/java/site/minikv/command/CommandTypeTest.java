package site.minikv.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import site.minikv.command.impl.Ping;
import site.minikv.command.impl.key.Del;
import site.minikv.command.impl.string.Get;
import site.minikv.command.impl.string.Set;
import site.minikv.core.ShardedKvStore;
import site.minikv.datastructure.KvBytes;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandType测试")
class CommandTypeTest {

    @ParameterizedTest
    @ValueSource(strings = {"GET", "get", "Get", "gEt"})
    @DisplayName("命令名查找大小写不敏感")
    void testFindIgnoresCase(String name) {
        assertEquals(CommandType.GET, CommandType.findByBytes(KvBytes.fromString(name)));
    }

    @Test
    void testFindUnknown() {
        assertNull(CommandType.findByBytes(KvBytes.fromString("FLUSHALL")));
        assertNull(CommandType.findByBytes(KvBytes.EMPTY));
        assertNull(CommandType.findByBytes(null));
        // 非ASCII字节不会被当作字母转换
        assertNull(CommandType.findByBytes(new KvBytes(new byte[]{'G', (byte) 0xC5, 'T'})));
    }

    @ParameterizedTest(name = "{0} 共{1}个元素 -> {2}")
    @CsvSource({
            "GET, 1, false",
            "GET, 2, true",
            "GET, 3, false",
            "SET, 2, false",
            "SET, 3, true",
            "SET, 4, false",
            "DEL, 1, false",
            "DEL, 2, true",
            "DEL, 10, true",
            "PING, 1, true",
            "PING, 2, true",
            "PING, 3, false"
    })
    @DisplayName("参数个数校验")
    void testAcceptsArgCount(CommandType type, int tokenCount, boolean expected) {
        assertEquals(expected, type.acceptsArgCount(tokenCount));
    }

    @Test
    void testLowerName() {
        assertEquals("get", CommandType.GET.getLowerName());
        assertEquals("del", CommandType.DEL.getLowerName());
    }

    @Test
    @DisplayName("工厂方法覆盖所有命令")
    void testCreateCommand() {
        ShardedKvStore store = new ShardedKvStore();

        assertTrue(CommandType.GET.createCommand(store) instanceof Get);
        assertTrue(CommandType.SET.createCommand(store) instanceof Set);
        assertTrue(CommandType.DEL.createCommand(store) instanceof Del);
        assertTrue(CommandType.PING.createCommand(store) instanceof Ping);

        for (CommandType type : CommandType.values()) {
            assertEquals(type, type.createCommand(store).getType());
        }
    }
}
