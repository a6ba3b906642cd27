package org.pkgcdn.cdn;

import org.pkgcdn.cdn.dto.ResolvedPackage;

import java.nio.file.Path;

/**
 * 默认实现：不生成打包文件，打包请求统一返回 404。
 */
public class NoBundlePackageBundler implements PackageBundler {

    @Override
    public Path createBundle(ResolvedPackage resolvedPackage) {
        return null;
    }
}
