package io.github.vevoly.hitset.core.tools;

import io.github.vevoly.hitset.api.exception.ArchiveException;

import java.io.File;

/**
 * <h3>归档文件查看器 (Archive Viewer)</h3>
 *
 * <p>
 * 一个命令行工具，用于将命中集归档文件 dump 为人类可读的 JSON 格式。
 * </p>
 *
 * <h3>用法 (Usage):</h3>
 * <pre>
 * java -cp ... HitSetViewer /path/to/hit_set_archive/hit_set_shard-1_archive_1700000000000_1700000600000
 * </pre>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class HitSetViewer {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.println("====== j-hitset Archive Viewer ======");

        // 1. 解析参数 / Parse arguments
        if (args.length == 0) {
            System.err.println("错误：请输入归档文件路径 / Error: Please enter the archive file path");
            System.err.println("用法 (Usage): java ... HitSetViewer <file_path>");
            return 2;
        }
        String path = args[0];

        File file = new File(path);
        if (!file.exists() || !file.isFile()) {
            System.err.println("文件不存在或不是一个有效文件 / File doesn't exist or is not a regular file: " + path);
            return 1;
        }

        // 2. 读取并解码 / Read and decode
        try {
            System.out.println("正在读取归档文件 / Loading archive file: " + file.getAbsolutePath());
            String json = HitSetAdminUtils.dumpArchive(path);
            System.out.println("\n================ 归档内容 / Archive Content ================");
            System.out.println(json);
            System.out.println("========================================");
            return 0;
        } catch (ArchiveException e) {
            System.err.println("读取归档失败 / Load failed: [" + e.getErrorCode().getCode() + "] " + e.getMessage());
            return 1;
        }
    }
}
