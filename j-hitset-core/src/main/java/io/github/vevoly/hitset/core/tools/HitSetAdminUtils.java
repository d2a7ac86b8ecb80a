package io.github.vevoly.hitset.core.tools;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.exception.ArchiveException;
import io.github.vevoly.hitset.core.HitSet;
import io.github.vevoly.hitset.core.archive.ArchiveEntry;
import io.github.vevoly.hitset.core.archive.HitSetArchive;
import io.github.vevoly.hitset.core.params.HitSetParams;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * <h3>运维工具类 (Hit Set Admin Utilities)</h3>
 *
 * <p>
 * 提供了一系列静态方法，把命中集、配置与归档内容转换为人类可读的 JSON。
 * 可被管理端点或命令行工具调用。
 * </p>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
@NoArgsConstructor
public class HitSetAdminUtils {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * 命中集的 JSON 形式 / Pretty JSON of a hit set
     */
    public static String dumpHitSet(HitSet hitSet) {
        JsonObject json = new JsonObject();
        hitSet.dump(json);
        return gson.toJson(json);
    }

    /**
     * 配置的 JSON 形式 / Pretty JSON of parameters
     */
    public static String dumpParams(HitSetParams params) {
        JsonObject json = new JsonObject();
        params.dump(json);
        return gson.toJson(json);
    }

    /**
     * <h3>加载并 Dump 归档文件 (Load & Dump Archive)</h3>
     * <p>
     * 输出中附带文件名解析出的分片与周期（文件名不符合格式时省略）。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Loads an archive file and dumps it, together with the shard and interval parsed from its name when possible.
     * </span>
     *
     * @param archivePath 归档文件<b>完整路径</b> / Full path to the archive file.
     * @return JSON 字符串 / JSON string
     * @throws ArchiveException 文件不存在或内容损坏 (Missing or corrupted)
     */
    public static String dumpArchive(String archivePath) throws ArchiveException {
        Path file = Paths.get(archivePath);
        HitSet hitSet = HitSetArchive.load(file);
        JsonObject json = new JsonObject();
        ArchiveEntry.parse(file.getFileName().toString()).ifPresent(entry -> {
            json.addProperty("shard", entry.getShard());
            json.addProperty("begin", entry.getBegin());
            json.addProperty("end", entry.getEnd());
        });
        JsonObject content = new JsonObject();
        hitSet.dump(content);
        json.add("hit_set", content);
        log.debug("归档已 Dump / Archive dumped: {}", file);
        return gson.toJson(json);
    }

    /**
     * 某分片全部归档的概要 / Summary of every archive of a shard
     */
    public static String listArchives(HitSetArchive archive, String shard) throws ArchiveException {
        JsonArray array = new JsonArray();
        for (ArchiveEntry entry : archive.list(shard)) {
            HitSet hitSet = archive.load(entry);
            JsonObject item = new JsonObject();
            item.addProperty("file", entry.getFileName());
            item.addProperty("begin", entry.getBegin());
            item.addProperty("end", entry.getEnd());
            item.addProperty("type", hitSet.getTypeName());
            if (hitSet.isTracking()) {
                item.addProperty("insert_count", hitSet.insertCount());
                item.addProperty("approx_unique_insert_count", hitSet.approxUniqueInsertCount());
            }
            array.add(item);
        }
        return gson.toJson(array);
    }
}
