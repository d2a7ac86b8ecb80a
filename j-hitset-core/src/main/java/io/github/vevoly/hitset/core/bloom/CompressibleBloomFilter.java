package io.github.vevoly.hitset.core.bloom;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.exception.MalformedInputException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <h3>可压缩布隆过滤器 (Compressible Bloom Filter)</h3>
 *
 * <p>
 * 针对 32 位值的布隆过滤器，支持按比例 <b>折叠压缩</b> 位表：第 {@code i} 个字节被 OR 到 {@code i mod newSize}。
 * 过滤器记录历次表大小 ({@code sizeList})，计算位下标时依次对每个历史大小取模，因此压缩后已插入的值仍然命中，不会产生漏判，
 * 代价是误判率与基数估算误差上升。
 * </p>
 * <ul>
 *     <li><b>参数选择:</b> 在 k = 1..999 中选取使位数 {@code m = -k·n / ln(1 - p^(1/k))} 最小的哈希个数。</li>
 *     <li><b>哈希:</b> 每个 salt 对应一个 Guava Murmur3_32 哈希函数，salt 由种子确定性派生，解码时重新生成。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Compressible Bloom Filter.</b><br>
 * A Bloom filter over 32-bit values whose bit table can be folded down: byte {@code i} is OR-ed into
 * {@code i mod newSize}. Every table size the filter has had is kept in {@code sizeList} and a bit index is reduced
 * modulo each of them in turn, so compression never introduces false negatives; it only raises the false positive
 * rate and the estimate error.<br>
 * <b>Sizing:</b> the hash count k in 1..999 minimising {@code m = -k·n / ln(1 - p^(1/k))}.<br>
 * <b>Hashing:</b> one Guava Murmur3_32 function per salt; salts derive from the seed and are regenerated on decode.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class CompressibleBloomFilter {

    private static final int BITS_PER_BYTE = 8;
    private static final int MAX_SALT_COUNT = 1000;
    private static final long DEFAULT_SEED = 0xA5A5A5A5L;
    private static final int STRUCT_VERSION = 2;
    private static final int COMPAT_VERSION = 2;

    // 用于从种子派生 salt / Derives salts from the seed
    private static final HashFunction SALT_FUNCTION = Hashing.murmur3_32_fixed();

    private int saltCount;
    private HashFunction[] hashFunctions;
    private byte[] bitTable;
    private long insertCount;
    private long targetElementCount;
    private long seed;

    /**
     * 历次位表大小（字节），最后一个元素等于当前位表大小.
     * <br>
     * <span style="color: gray;">Every table size in bytes, oldest first; the last one is the current size.</span>
     */
    private final List<Long> sizeList;

    /**
     * 无参构造函数 (No-Arg Constructor).
     * <p>不分配位表，仅作为解码目标使用。</p>
     * <span style="color: gray;">No bit table; only used as a decode target.</span>
     */
    public CompressibleBloomFilter() {
        this.hashFunctions = new HashFunction[0];
        this.sizeList = new ArrayList<>();
    }

    /**
     * 构造函数 (Constructor).
     *
     * @param targetElementCount 预计唯一插入数 (Expected unique insertions), 必须 &gt; 0
     * @param falsePositive      目标误判率 (Target false positive probability), 取值 (0, 1)
     * @param seed               随机种子，0 表示使用默认种子 (Seed, 0 selects the default seed)
     */
    public CompressibleBloomFilter(long targetElementCount, double falsePositive, long seed) {
        Preconditions.checkArgument(targetElementCount > 0, "target element count must be > 0: %s", targetElementCount);
        Preconditions.checkArgument(falsePositive > 0.0 && falsePositive < 1.0,
                "false positive probability must be in (0, 1): %s", falsePositive);
        this.targetElementCount = targetElementCount;
        this.seed = seed != 0 ? seed : DEFAULT_SEED;
        this.sizeList = new ArrayList<>();

        double minBits = Double.POSITIVE_INFINITY;
        int bestSaltCount = 1;
        for (int k = 1; k < MAX_SALT_COUNT; k++) {
            double bits = (-k * (double) targetElementCount) / Math.log(1.0 - Math.pow(falsePositive, 1.0 / k));
            if (bits < minBits) {
                minBits = bits;
                bestSaltCount = k;
            }
        }
        long tableBits = (long) Math.ceil(minBits);
        if (tableBits % BITS_PER_BYTE != 0) {
            tableBits += BITS_PER_BYTE - (tableBits % BITS_PER_BYTE);
        }
        long tableBytes = Math.max(1L, tableBits / BITS_PER_BYTE);
        Preconditions.checkArgument(tableBytes <= Integer.MAX_VALUE - BITS_PER_BYTE,
                "bloom filter too large: %s bytes", tableBytes);

        this.saltCount = bestSaltCount;
        this.hashFunctions = buildHashFunctions(saltCount, this.seed);
        this.bitTable = new byte[(int) tableBytes];
        this.sizeList.add(tableBytes);
    }

    private CompressibleBloomFilter(CompressibleBloomFilter other) {
        this.saltCount = other.saltCount;
        this.hashFunctions = other.hashFunctions;
        this.bitTable = other.bitTable == null ? null : other.bitTable.clone();
        this.insertCount = other.insertCount;
        this.targetElementCount = other.targetElementCount;
        this.seed = other.seed;
        this.sizeList = new ArrayList<>(other.sizeList);
    }

    public CompressibleBloomFilter copy() {
        return new CompressibleBloomFilter(this);
    }

    /**
     * 插入一个 32 位值 (Insert a 32-bit value).
     *
     * @throws IllegalStateException 位表未分配 (No bit table allocated)
     */
    public void insert(int value) {
        Preconditions.checkState(bitTable != null, "bloom filter has no bit table");
        for (HashFunction function : hashFunctions) {
            long bit = bitIndex(function, value);
            bitTable[(int) (bit >>> 3)] |= (byte) (1 << (bit & 7));
        }
        insertCount++;
    }

    public boolean contains(int value) {
        if (bitTable == null) {
            return false;
        }
        for (HashFunction function : hashFunctions) {
            long bit = bitIndex(function, value);
            if ((bitTable[(int) (bit >>> 3)] & (1 << (bit & 7))) == 0) {
                return false;
            }
        }
        return true;
    }

    private long bitIndex(HashFunction function, int value) {
        long index = Integer.toUnsignedLong(function.hashInt(value).asInt());
        for (long size : sizeList) {
            index %= size * BITS_PER_BYTE;
        }
        return index;
    }

    /**
     * 原始插入次数 / Raw insert counter
     */
    public long elementCount() {
        return insertCount;
    }

    /**
     * 位表中置 1 的比例 / Fraction of bits set
     */
    public double density() {
        if (bitTable == null || bitTable.length == 0) {
            return 0.0;
        }
        long setBits = 0;
        for (byte b : bitTable) {
            setBits += Integer.bitCount(b & 0xFF);
        }
        return (double) setBits / ((double) bitTable.length * BITS_PER_BYTE);
    }

    /**
     * <h3>唯一元素数估算 (Unique Element Estimate)</h3>
     * <p>
     * 按位密度估算：{@code n ≈ -(m / k) · ln(1 - density)}，结果截断到 {@code [0, elementCount()]}。
     * 位表写满时无法估算，直接返回原始插入次数。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Density based estimate {@code n ≈ -(m / k) · ln(1 - density)}, clamped to {@code [0, elementCount()]}.
     * A saturated table cannot be estimated and reports the raw insert count.
     * </span>
     */
    public long approxUniqueElementCount() {
        if (bitTable == null || saltCount == 0) {
            return 0L;
        }
        double density = density();
        if (density >= 1.0) {
            return insertCount;
        }
        double bits = (double) bitTable.length * BITS_PER_BYTE;
        long estimate = Math.round(-(bits / saltCount) * Math.log(1.0 - density));
        return Math.min(Math.max(estimate, 0L), insertCount);
    }

    /**
     * <h3>压缩位表 (Compress Bit Table)</h3>
     * <p>
     * 将位表缩小到当前大小的 {@code percent}%。百分比不在 (0, 100) 内、或新大小为 0 / 不小于当前大小时不做任何修改。
     * <b>这是破坏性操作</b>：压缩后应不再插入。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Shrinks the table to {@code percent}% of its current size. Percentages outside (0, 100), or a resulting size
     * that is 0 or not smaller, leave the filter untouched. <b>Destructive</b>: do not insert afterwards.
     * </span>
     *
     * @param percent 目标百分比 (Target percentage of the current size)
     * @return 是否执行了压缩 (Whether the table was compressed)
     */
    public boolean compress(double percent) {
        if (bitTable == null) {
            return false;
        }
        if (!(percent > 0.0 && percent < 100.0)) {
            return false;
        }
        int originalSize = bitTable.length;
        int newSize = (int) (originalSize * percent / 100.0);
        if (newSize == 0 || newSize >= originalSize) {
            return false;
        }
        byte[] folded = Arrays.copyOf(bitTable, newSize);
        for (int i = newSize; i < originalSize; i++) {
            folded[i % newSize] |= bitTable[i];
        }
        bitTable = folded;
        sizeList.add((long) newSize);
        return true;
    }

    public int getSaltCount() {
        return saltCount;
    }

    /**
     * 当前位表大小（字节）/ Current table size in bytes
     */
    public int getTableSize() {
        return bitTable == null ? 0 : bitTable.length;
    }

    public long getTargetElementCount() {
        return targetElementCount;
    }

    public long getSeed() {
        return seed;
    }

    public List<Long> getSizeList() {
        return Collections.unmodifiableList(sizeList);
    }

    public void encode(WireOutput out) {
        byte[] table = bitTable == null ? new byte[0] : bitTable;
        out.writeEnvelope(STRUCT_VERSION, COMPAT_VERSION, body -> {
            body.writeU64(saltCount)
                    .writeU64(insertCount)
                    .writeU64(targetElementCount)
                    .writeU64(seed)
                    .writeBytes(table)
                    .writeU32(sizeList.size());
            for (long size : sizeList) {
                body.writeU64(size);
            }
        });
    }

    public void decode(WireInput in) throws MalformedInputException {
        in.readEnvelope(STRUCT_VERSION, (body, structVersion) -> {
            long decodedSaltCount = body.readU64();
            long decodedInsertCount = body.readU64();
            long decodedTarget = body.readU64();
            long decodedSeed = body.readU64();
            byte[] table = body.readBytes();
            long sizeCount = body.readU32();
            if (sizeCount * Long.BYTES > body.remaining()) {
                throw new MalformedInputException("布隆过滤器大小列表越界 / Bloom size list exceeds payload: " + sizeCount);
            }
            List<Long> sizes = new ArrayList<>((int) sizeCount);
            for (long i = 0; i < sizeCount; i++) {
                sizes.add(body.readU64());
            }
            validate(decodedSaltCount, table, sizes);

            this.saltCount = (int) decodedSaltCount;
            this.insertCount = decodedInsertCount;
            this.targetElementCount = decodedTarget;
            this.seed = decodedSeed;
            this.hashFunctions = buildHashFunctions(saltCount, decodedSeed);
            this.bitTable = table.length == 0 ? null : table;
            this.sizeList.clear();
            this.sizeList.addAll(sizes);
        });
    }

    private static void validate(long saltCount, byte[] table, List<Long> sizes) throws MalformedInputException {
        if (saltCount < 0 || saltCount >= MAX_SALT_COUNT) {
            throw new MalformedInputException("非法的 salt 数量 / Invalid bloom salt count: " + saltCount);
        }
        if (table.length == 0) {
            if (!sizes.isEmpty() || saltCount != 0) {
                throw new MalformedInputException("空位表却携带了参数 / Empty bloom table with sizing data");
            }
            return;
        }
        if (saltCount == 0 || sizes.isEmpty() || sizes.get(sizes.size() - 1) != table.length) {
            throw new MalformedInputException(String.format(
                    "位表大小与大小列表不一致 / Bloom table of %d bytes does not match size list %s", table.length, sizes));
        }
        long previous = Long.MAX_VALUE;
        for (long size : sizes) {
            if (size <= 0 || size > previous) {
                throw new MalformedInputException("大小列表必须递减 / Bloom size list must be decreasing: " + sizes);
            }
            previous = size;
        }
    }

    public void dump(JsonObject json) {
        json.addProperty("salt_count", saltCount);
        json.addProperty("table_size", getTableSize());
        json.addProperty("insert_count", insertCount);
        json.addProperty("target_element_count", targetElementCount);
        json.addProperty("seed", seed);
        json.addProperty("density", density());
        JsonArray sizes = new JsonArray();
        sizeList.forEach(sizes::add);
        json.add("size_list", sizes);
    }

    private static HashFunction[] buildHashFunctions(int count, long seed) {
        HashFunction[] functions = new HashFunction[count];
        for (int i = 0; i < count; i++) {
            int salt = SALT_FUNCTION.newHasher()
                    .putLong(seed)
                    .putInt(i)
                    .hash()
                    .asInt();
            functions[i] = Hashing.murmur3_32_fixed(salt);
        }
        return functions;
    }
}
