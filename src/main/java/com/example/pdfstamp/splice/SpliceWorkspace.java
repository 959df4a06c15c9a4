package com.example.pdfstamp.splice;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 一次拼接使用的临时目录，关闭时连同其中的中间文件一起删除
 */
@Slf4j
public class SpliceWorkspace implements AutoCloseable {

    private final Path directory;

    public SpliceWorkspace() throws IOException {
        this.directory = Files.createTempDirectory("pdf-stamp-");
        log.trace("临时目录已创建: {}", directory);
    }

    public Path file(String name) {
        return directory.resolve(name);
    }

    @Override
    public void close() {
        try {
            FileSystemUtils.deleteRecursively(directory);
            log.trace("临时目录已删除: {}", directory);
        } catch (IOException e) {
            log.warn("删除临时目录失败: {}", directory, e);
        }
    }
}
