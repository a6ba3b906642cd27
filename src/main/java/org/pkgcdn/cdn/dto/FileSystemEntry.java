package org.pkgcdn.cdn.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * 目录树条目（递归）。
 *
 * @param path         相对包根目录的路径（统一使用 / 分隔，以 / 开头）
 * @param lastModified 最后修改时间
 * @param contentType  按文件名推断的 MIME 类型
 * @param size         lstat 得到的大小（字节）
 * @param type         文件类型
 * @param children     子条目（按目录列举顺序）；文件或深度已用尽的目录为 null，空目录为空列表
 */
public record FileSystemEntry(
        String path,
        Instant lastModified,
        String contentType,
        long size,
        EntryType type,
        @JsonInclude(JsonInclude.Include.NON_NULL) List<FileSystemEntry> children
) {

    public boolean isExpanded() {
        return children != null;
    }
}
