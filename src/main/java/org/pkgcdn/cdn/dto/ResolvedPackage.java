package org.pkgcdn.cdn.dto;

import java.nio.file.Path;

/**
 * 已确定精确版本的包，以及它在本地缓存中的目录。
 *
 * @param packageName    包名
 * @param exactVersion   精确版本号
 * @param cacheDirectory 解包目录（由包名与版本号唯一确定）
 */
public record ResolvedPackage(
        String packageName,
        String exactVersion,
        Path cacheDirectory
) {

    public String displayName() {
        return packageName + "@" + exactVersion;
    }
}
