package com.vespasync.sync.checkpoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 模块说明：CheckpointStore（class）。
 * 主要职责：在本地文件中读写 {@link SyncCheckpoint}，文件不存在即表示从头开始。
 * 使用建议：写入先落临时文件再整体替换，中途崩溃不会留下半个 JSON。
 */
public final class CheckpointStore {
    private final Path path;

    public CheckpointStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

/**
 * 方法说明：load，负责加载断点数据。
 * 处理流程：文件缺失返回 empty；内容损坏或版本不兼容时输出 WARN 并同样返回 empty。
 */
    public Optional<SyncCheckpoint> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            String raw = Files.readString(path, StandardCharsets.UTF_8);
            if (raw.trim().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(SyncCheckpoint.fromJson(raw));
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("WARN: ignoring unreadable checkpoint " + path + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    public void save(SyncCheckpoint checkpoint) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, checkpoint.toJson().toString(2), StandardCharsets.UTF_8);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public boolean delete() throws IOException {
        Files.deleteIfExists(path.resolveSibling(path.getFileName() + ".tmp"));
        return Files.deleteIfExists(path);
    }
}
