package io.github.vevoly.hitset.api.constants;

/**
 * 系统常量 / System constant
 *
 * @since 1.0.0
 * @author vevoly
 */
public class HitSetConstant {

    public static final String J_HITSET_ID = "j-hitset";

    // 配置默认值 / Config default value
    public static final HitSetType DEFAULT_TYPE = HitSetType.BLOOM;
    public static final double DEFAULT_BLOOM_FALSE_POSITIVE = 0.05;
    public static final long DEFAULT_BLOOM_TARGET_SIZE = 1000L;
    public static final long DEFAULT_BLOOM_SEED = 0L;
    public static final String DEFAULT_METRICS_PREFIX = J_HITSET_ID + ".";

    // 归档文件命名 / Archive file naming
    public static final String ARCHIVE_FILE_PREFIX = "hit_set_";
    public static final String ARCHIVE_MARK = "_archive_";
    public static final String ARCHIVE_TEMP_SUFFIX = ".tmp";
    public static final String ARCHIVE_DIR = "hit_set_archive";

    public static final String META_ARCHIVE_BASE_DIR = J_HITSET_ID + ".archive.base-dir";

    private HitSetConstant() {
    }
}
