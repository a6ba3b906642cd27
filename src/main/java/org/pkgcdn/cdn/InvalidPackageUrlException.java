package org.pkgcdn.cdn;

/**
 * 请求路径无法解析为 {@code /name@version/file}。
 */
public class InvalidPackageUrlException extends RuntimeException {

    private final String url;

    public InvalidPackageUrlException(String url) {
        super("Invalid URL: " + url);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
