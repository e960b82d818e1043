package site.minikv.database;

import lombok.Getter;
import site.minikv.datastructure.KvBytes;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 存储分片
 *
 * <p>一个分片是一张由读写锁保护的哈希表。单键操作在方法内部加锁；
 * 批量操作需要调用方先通过 {@link #writeLock()} 持有写锁，再调用 {@code *Locked} 方法。
 *
 * @since 1.0.0
 */
public class KvShard {

    /** 分片编号，也是批量操作的加锁顺序 */
    @Getter
    private final int id;

    /** 底层数据，只能在持有锁时访问 */
    private final Map<KvBytes, KvBytes> data = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public KvShard(int id) {
        this.id = id;
    }

    public KvBytes get(KvBytes key) {
        lock.readLock().lock();
        try {
            return data.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(KvBytes key, KvBytes value) {
        lock.writeLock().lock();
        try {
            data.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(KvBytes key) {
        lock.writeLock().lock();
        try {
            return data.remove(key) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 在已持有写锁的前提下删除
     *
     * @param key 要删除的键
     * @return 如果键存在并被删除返回true
     */
    public boolean removeLocked(KvBytes key) {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("分片" + id + "的写锁未被当前线程持有");
        }
        return data.remove(key) != null;
    }

    public ReentrantReadWriteLock.WriteLock writeLock() {
        return lock.writeLock();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            data.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
