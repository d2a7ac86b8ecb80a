package io.github.vevoly.hitset.api;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;

/**
 * <h3>命中跟踪策略接口 (Hit Tracking Strategy Interface)</h3>
 *
 * <p>
 * 定义如何记录"哪些对象在本周期内被访问过"。框架内置显式哈希集合、显式对象集合与可压缩布隆过滤器三种实现，
 * 由 {@code HitSet} 容器根据类型标签创建并统一对外暴露。
 * </p>
 * <p>
 * <b>实现要求 (Implementation Requirements):</b>
 * <ul>
 *     <li>{@link #insertCount()} 统计每一次插入（重复也计数），且始终 {@code >=} {@link #approxUniqueInsertCount()}。</li>
 *     <li>已插入的对象 {@link #contains(HObject)} 必须返回 true，不允许漏判。</li>
 *     <li>编解码必须严格对称。</li>
 * </ul>
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Hit Tracking Strategy Interface.</b><br>
 * Records which objects were accessed during an interval. Built-in implementations: explicit hash set,
 * explicit object set and compressible Bloom filter.<br>
 * <b>Requirements:</b> insert count counts every call and is never below the unique estimate; inserted objects are
 * never reported absent; encode and decode are exactly symmetric.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface HitTracker {

    /**
     * 策略对应的类型标签 / Type tag of this strategy
     */
    HitSetType getType();

    /**
     * 记录一次访问 (Record a hit).
     *
     * @param object 被访问的对象 (Accessed object)
     */
    void insert(HObject object);

    /**
     * 查询对象是否被访问过 (Membership query).
     *
     * @param object 对象 (Object)
     * @return true=可能访问过(概率型策略可能误判), false=一定未访问 / true=maybe hit, false=definitely not hit
     */
    boolean contains(HObject object);

    /**
     * 原始插入次数 / Raw number of insert calls
     */
    long insertCount();

    /**
     * 去重后的插入数量（显式策略为精确值，布隆过滤器为估算值）.
     * <br>
     * <span style="color: gray;">Unique insertions: exact for explicit strategies, estimated for Bloom.</span>
     */
    long approxUniqueInsertCount();

    /**
     * 周期结束、持久化前压缩内部结构 (可选).
     *
     * <span style="color: gray; font-size: 0.9em;">Shrink the structure at the end of an interval, before persisting (Optional).</span>
     */
    default void optimize() {}

    void encode(WireOutput out);

    /**
     * 从线路格式恢复状态，覆盖当前内容 / Replace the current state with the decoded one
     */
    void decode(WireInput in) throws MalformedInputException;

    /**
     * 输出结构化诊断信息 / Structured diagnostic dump
     */
    void dump(JsonObject json);

    /**
     * 深拷贝 / Deep copy
     */
    HitTracker copy();
}
