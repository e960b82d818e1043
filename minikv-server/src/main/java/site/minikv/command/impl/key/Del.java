package site.minikv.command.impl.key;

import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.core.KvStore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespInteger;

import java.util.ArrayList;
import java.util.List;

/**
 * DEL命令实现
 *
 * <p>返回实际被删除的键的数量。单个键直接删除，多个键交给存储的批量删除，
 * 由存储保证按固定顺序加锁。
 */
public class Del implements Command {
    private final KvStore store;
    private List<KvBytes> keys;

    public Del(KvStore store) {
        this.store = store;
    }

    @Override
    public CommandType getType() {
        return CommandType.DEL;
    }

    @Override
    public void setContext(Resp[] array) {
        keys = new ArrayList<>(array.length - 1);
        for (int i = 1; i < array.length; i++) {
            keys.add(((BulkString) array[i]).getContent());
        }
    }

    @Override
    public Resp handle() {
        if (keys.size() == 1) {
            return store.delete(keys.get(0)) ? RespInteger.ONE : RespInteger.ZERO;
        }
        return RespInteger.valueOf(store.delete(keys));
    }
}
