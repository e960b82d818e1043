package site.minikv.core;

import site.minikv.datastructure.KvBytes;

import java.util.Collection;

/**
 * 键值存储核心操作接口
 *
 * <p>进程内唯一的共享可变对象，被所有连接并发访问，调用方无需额外同步。
 * 键与值都是不可变的 {@link KvBytes}，读出的值不会被其他调用改变，写入的值也不会被调用方改变。
 *
 * <p>一致性保证：set/delete 返回之后开始的 get 一定能看到其结果；
 * 在它开始之前就已结束的 get 一定看不到。
 *
 * @since 1.0.0
 */
public interface KvStore {

    /**
     * 获取指定键的值
     *
     * @param key 要获取的键
     * @return 对应的值，如果键不存在则返回null
     */
    KvBytes get(KvBytes key);

    /**
     * 存储键值对，已存在时原子地覆盖
     *
     * @param key 键
     * @param value 值
     */
    void set(KvBytes key, KvBytes value);

    /**
     * 删除指定键
     *
     * @param key 要删除的键
     * @return 如果键存在并被删除返回true，否则返回false
     */
    boolean delete(KvBytes key);

    /**
     * 批量删除，重复的键只计一次
     *
     * @param keys 要删除的键
     * @return 实际被删除的键的数量
     */
    long delete(Collection<KvBytes> keys);

    /**
     * 键值对的数量
     *
     * @return 键值对数量
     */
    long size();

    /**
     * 清空所有数据
     */
    void clear();
}
