package site.minikv.core;

import lombok.extern.slf4j.Slf4j;
import site.minikv.database.KvShard;
import site.minikv.datastructure.KvBytes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 分片键值存储实现
 *
 * <p>数据被划分到固定数量的 {@link KvShard} 中，分片数必须是2的幂，
 * 键通过哈希值选择分片。不同分片上的操作互不阻塞。
 *
 * <p>批量删除按分片编号升序获取所有涉及分片的写锁，逆序释放，
 * 因此任意两个并发的批量删除都不会死锁。
 *
 * @since 1.0.0
 */
@Slf4j
public class ShardedKvStore implements KvStore {

    /** 默认分片数 */
    public static final int DEFAULT_SHARD_COUNT = 16;

    private final KvShard[] shards;

    private final int mask;

    public ShardedKvStore() {
        this(DEFAULT_SHARD_COUNT);
    }

    /**
     * 构造函数
     *
     * @param shardCount 分片数，必须是正的2的幂
     */
    public ShardedKvStore(final int shardCount) {
        if (shardCount <= 0 || Integer.bitCount(shardCount) != 1) {
            throw new IllegalArgumentException("分片数必须是2的幂: " + shardCount);
        }
        this.shards = new KvShard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new KvShard(i);
        }
        this.mask = shardCount - 1;
        log.debug("存储初始化完成，分片数: {}", shardCount);
    }

    public int getShardCount() {
        return shards.length;
    }

    /**
     * 计算键所属的分片编号
     *
     * @param key 键
     * @return 分片编号
     */
    int shardIndex(final KvBytes key) {
        final int h = key.hashCode();
        // 混合高位，避免只有低位参与选择
        return (h ^ (h >>> 16)) & mask;
    }

    private KvShard shardFor(final KvBytes key) {
        return shards[shardIndex(key)];
    }

    @Override
    public KvBytes get(final KvBytes key) {
        requireKey(key);
        return shardFor(key).get(key);
    }

    @Override
    public void set(final KvBytes key, final KvBytes value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("值不能为null");
        }
        shardFor(key).put(key, value);
    }

    @Override
    public boolean delete(final KvBytes key) {
        requireKey(key);
        return shardFor(key).remove(key);
    }

    @Override
    public long delete(final Collection<KvBytes> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("键集合不能为null");
        }
        if (keys.isEmpty()) {
            return 0;
        }

        // 1. 按分片编号升序分组，重复的键只保留一个
        final Map<Integer, Collection<KvBytes>> byShard = new TreeMap<>();
        for (final KvBytes key : keys) {
            requireKey(key);
            byShard.computeIfAbsent(shardIndex(key), i -> new LinkedHashSet<>()).add(key);
        }

        // 2. 按升序加锁
        final List<KvShard> locked = new ArrayList<>(byShard.size());
        try {
            for (final Integer index : byShard.keySet()) {
                final KvShard shard = shards[index];
                shard.writeLock().lock();
                locked.add(shard);
            }

            // 3. 在所有锁内完成删除
            long deleted = 0;
            for (final Map.Entry<Integer, Collection<KvBytes>> entry : byShard.entrySet()) {
                final KvShard shard = shards[entry.getKey()];
                for (final KvBytes key : entry.getValue()) {
                    if (shard.removeLocked(key)) {
                        deleted++;
                    }
                }
            }
            return deleted;
        } finally {
            // 4. 逆序释放
            for (int i = locked.size() - 1; i >= 0; i--) {
                locked.get(i).writeLock().unlock();
            }
        }
    }

    @Override
    public long size() {
        long total = 0;
        for (final KvShard shard : shards) {
            total += shard.size();
        }
        return total;
    }

    @Override
    public void clear() {
        for (final KvShard shard : shards) {
            shard.clear();
        }
        log.debug("存储已清空");
    }

    private static void requireKey(final KvBytes key) {
        if (key == null) {
            throw new IllegalArgumentException("键不能为null");
        }
    }
}
