package site.minikv.server.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.minikv.core.KvStore;
import site.minikv.core.ShardedKvStore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.*;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("CommandDispatcher测试")
class CommandDispatcherTest {

    private KvStore store;
    private CommandDispatcher dispatcher;

    private static RespArray request(String... tokens) {
        return RespArray.valueOf(Arrays.stream(tokens).map(BulkString::fromString).toList());
    }

    @BeforeEach
    void setUp() {
        store = new ShardedKvStore();
        dispatcher = new CommandDispatcher(store);
    }

    @Nested
    @DisplayName("GET/SET/DEL")
    class StringCommands {

        @Test
        void testSetThenGet() {
            assertEquals(SimpleString.OK, dispatcher.dispatch(request("SET", "foo", "bar")));
            assertEquals(BulkString.fromString("bar"), dispatcher.dispatch(request("GET", "foo")));
        }

        @Test
        void testGetMissing() {
            assertEquals(BulkString.NULL, dispatcher.dispatch(request("GET", "nope")));
        }

        @Test
        void testSetOverwrites() {
            dispatcher.dispatch(request("SET", "k", "a"));
            dispatcher.dispatch(request("SET", "k", "b"));

            assertEquals(BulkString.fromString("b"), dispatcher.dispatch(request("GET", "k")));
        }

        @Test
        @DisplayName("DEL x missing 返回1")
        void testDelCountsOnlyExisting() {
            dispatcher.dispatch(request("SET", "x", "1"));

            assertEquals(RespInteger.ONE, dispatcher.dispatch(request("DEL", "x", "missing")));
            assertEquals(BulkString.NULL, dispatcher.dispatch(request("GET", "x")));
            assertEquals(RespInteger.ZERO, dispatcher.dispatch(request("DEL", "x")));
        }

        @Test
        void testDelManyKeys() {
            dispatcher.dispatch(request("SET", "a", "1"));
            dispatcher.dispatch(request("SET", "b", "2"));
            dispatcher.dispatch(request("SET", "c", "3"));

            assertEquals(RespInteger.valueOf(3), dispatcher.dispatch(request("DEL", "a", "b", "c", "a")));
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("二进制值原样返回")
        void testBinaryValue() {
            byte[] value = {0, (byte) 0xFF, '\r', '\n'};
            dispatcher.dispatch(new RespArray(BulkString.SET, BulkString.fromString("bin"), BulkString.create(value)));

            Resp reply = dispatcher.dispatch(request("GET", "bin"));

            assertArrayEquals(value, ((BulkString) reply).getContent().getBytes());
        }

        @Test
        void testLowerCaseCommandName() {
            assertEquals(SimpleString.OK, dispatcher.dispatch(request("set", "k", "v")));
            assertEquals(BulkString.fromString("v"), dispatcher.dispatch(request("get", "k")));
        }
    }

    @Nested
    @DisplayName("命令级错误")
    class CommandErrors {

        @Test
        @DisplayName("GET key value 返回参数个数错误")
        void testGetArity() {
            assertEquals(new Errors("wrong number of arguments for 'get'"),
                    dispatcher.dispatch(request("GET", "key", "value")));
            assertEquals(new Errors("wrong number of arguments for 'get'"),
                    dispatcher.dispatch(request("GET")));
        }

        @Test
        void testSetArity() {
            assertEquals(new Errors("wrong number of arguments for 'set'"),
                    dispatcher.dispatch(request("SET", "k")));
            assertEquals(0, store.size());
        }

        @Test
        void testDelArity() {
            assertEquals(new Errors("wrong number of arguments for 'del'"), dispatcher.dispatch(request("DEL")));
        }

        @Test
        void testPingArity() {
            assertEquals(new Errors("wrong number of arguments for 'ping'"),
                    dispatcher.dispatch(request("PING", "a", "b")));
        }

        @Test
        @DisplayName("未知命令回显原始命令名")
        void testUnknownCommand() {
            assertEquals(new Errors("unknown command 'FooBar'"), dispatcher.dispatch(request("FooBar", "x")));
        }

        @Test
        void testEmptyRequest() {
            assertEquals(CommandDispatcher.EMPTY_COMMAND_ERROR, dispatcher.dispatch(RespArray.EMPTY));
        }

        @Test
        @DisplayName("非批量字符串元素被拒绝")
        void testInvalidElements() {
            assertEquals(CommandDispatcher.INVALID_REQUEST_ERROR,
                    dispatcher.dispatch(new RespArray(BulkString.GET, RespInteger.ONE)));
            assertEquals(CommandDispatcher.INVALID_REQUEST_ERROR,
                    dispatcher.dispatch(new RespArray(BulkString.GET, BulkString.NULL)));
        }
    }

    @Test
    void testPing() {
        assertEquals(SimpleString.PONG, dispatcher.dispatch(request("PING")));
        assertEquals(BulkString.fromString("hello"), dispatcher.dispatch(request("ping", "hello")));
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("与存储的交互")
    class StoreInteraction {

        @Mock
        private KvStore mockStore;

        @Test
        @DisplayName("命令级错误不会触及存储")
        void testErrorsNeverTouchStore() {
            CommandDispatcher mocked = new CommandDispatcher(mockStore);

            mocked.dispatch(request("GET", "key", "value"));
            mocked.dispatch(request("SET", "k"));
            mocked.dispatch(request("UNKNOWN", "k"));

            verifyNoInteractions(mockStore);
        }

        @Test
        @DisplayName("存储抛出意外异常时回复内部错误")
        void testUnexpectedFailure() {
            when(mockStore.get(any(KvBytes.class))).thenThrow(new IllegalStateException("boom"));
            CommandDispatcher mocked = new CommandDispatcher(mockStore);

            assertEquals(CommandDispatcher.INTERNAL_ERROR, mocked.dispatch(request("GET", "k")));
        }

        @Test
        @DisplayName("单键DEL走单键删除")
        void testSingleKeyDelete() {
            when(mockStore.delete(KvBytes.fromString("k"))).thenReturn(true);
            CommandDispatcher mocked = new CommandDispatcher(mockStore);

            assertEquals(RespInteger.ONE, mocked.dispatch(request("DEL", "k")));
            verify(mockStore).delete(KvBytes.fromString("k"));
            verifyNoMoreInteractions(mockStore);
        }
    }

    @Test
    void testRejectsNullStore() {
        assertThrows(IllegalArgumentException.class, () -> new CommandDispatcher(null));
    }
}
