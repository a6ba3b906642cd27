package org.pkgcdn.cdn;

import org.pkgcdn.cdn.dto.ResolvedPackage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 为某个已缓存的包生成打包文件（{@code app.cdn.bundle-path} 请求走这里，而不是普通文件解析）。
 */
public interface PackageBundler {

    /**
     * @return 生成的打包文件；该包不支持打包时为 null
     */
    Path createBundle(ResolvedPackage resolvedPackage) throws IOException;
}
