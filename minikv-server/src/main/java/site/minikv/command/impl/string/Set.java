package site.minikv.command.impl.string;

import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.core.KvStore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;

public class Set implements Command {
    private final KvStore store;
    private KvBytes key;
    private KvBytes value;

    public Set(KvStore store) {
        this.store = store;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(Resp[] array) {
        key = ((BulkString) array[1]).getContent();
        value = ((BulkString) array[2]).getContent();
    }

    @Override
    public Resp handle() {
        store.set(key, value);
        return SimpleString.OK;
    }
}
