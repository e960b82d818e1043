package site.minikv.command.impl;

import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Resp;
import site.minikv.protocol.SimpleString;

/**
 * PING命令实现，不带参数时回复PONG，带消息时原样返回消息
 */
public class Ping implements Command {
    private BulkString message;

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(Resp[] array) {
        message = array.length > 1 ? (BulkString) array[1] : null;
    }

    @Override
    public Resp handle() {
        return message == null ? SimpleString.PONG : message;
    }
}
