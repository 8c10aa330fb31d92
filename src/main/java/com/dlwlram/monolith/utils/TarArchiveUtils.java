package com.dlwlram.monolith.utils;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.io.IoUtil;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * 与运行环境之间传输文件使用的 tar 打包工具类
 */
public class TarArchiveUtils {

    private TarArchiveUtils() {
    }

    /**
     * 将单个文件打包为 tar, 包内只保留文件名
     *
     * @param file 本地文件
     * @return tar 字节
     */
    public static byte[] archiveFile(File file) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(bytes)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            TarArchiveEntry entry = new TarArchiveEntry(file, file.getName());
            tar.putArchiveEntry(entry);
            Files.copy(file.toPath(), tar);
            tar.closeArchiveEntry();
            tar.finish();
        } catch (IOException e) {
            throw new IORuntimeException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * 将 tar 流解压到本地目录
     *
     * @param tarStream tar 流, 方法内关闭
     * @param destDir   目标目录, 不存在时创建
     * @return 解压出的文件, 没有任何条目时为空
     */
    public static List<File> extract(InputStream tarStream, File destDir) {
        List<File> extracted = new ArrayList<>();
        FileUtil.mkdir(destDir);
        try (TarArchiveInputStream tar = new TarArchiveInputStream(tarStream)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextTarEntry()) != null) {
                File target = new File(destDir, entry.getName());
                //防止条目名称跳出目标目录
                if (!FileUtil.isSub(destDir, target)) {
                    throw new IOException("非法的 tar 条目: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    FileUtil.mkdir(target);
                    continue;
                }
                FileUtil.mkParentDirs(target);
                try (OutputStream out = FileUtil.getOutputStream(target)) {
                    IoUtil.copy(tar, out);
                }
                extracted.add(target);
            }
        } catch (IOException e) {
            throw new IORuntimeException(e);
        }
        return extracted;
    }
}
