package site.minikv.command.impl.string;

import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.core.KvStore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;

/**
 * GET命令实现，键不存在时返回空批量字符串
 */
public class Get implements Command {
    private final KvStore store;
    private KvBytes key;

    public Get(KvStore store) {
        this.store = store;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(Resp[] array) {
        key = ((BulkString) array[1]).getContent();
    }

    @Override
    public Resp handle() {
        KvBytes value = store.get(key);
        return value == null ? BulkString.NULL : new BulkString(value);
    }
}
