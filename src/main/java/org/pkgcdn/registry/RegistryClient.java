package org.pkgcdn.registry;

import org.pkgcdn.cdn.dto.PackageInfo;

/**
 * 包注册中心客户端。
 */
public interface RegistryClient {

    /**
     * 拉取包元数据（版本列表与 dist-tags）。
     *
     * @return 包元数据；注册中心返回 404 时为 null
     * @throws RegistryException 网络错误、非预期状态码或响应无法解析
     */
    PackageInfo getPackageInfo(String packageName);
}
