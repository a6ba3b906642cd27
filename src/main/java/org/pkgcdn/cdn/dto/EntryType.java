package org.pkgcdn.cdn.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 目录列表条目的文件类型（按 lstat 结果分类，符号链接不跟随）。
 */
public enum EntryType {
    FILE("file"),
    DIRECTORY("directory"),
    BLOCK_DEVICE("blockDevice"),
    CHARACTER_DEVICE("characterDevice"),
    SYMLINK("symlink"),
    FIFO("fifo"),
    SOCKET("socket"),
    UNKNOWN("unknown");

    private final String jsonName;

    EntryType(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }
}
