package org.pkgcdn.cdn;

/**
 * 请求的包、版本、manifest 字段或文件不存在。
 * <p>
 * {@link #getSubject()} 是面向调用方的描述（例如 {@code package "foo"}、{@code file "/a.js" in package foo@1.0.0}），
 * 会原样出现在 404 响应里。
 */
public class PackageNotFoundException extends RuntimeException {

    private final String subject;

    public PackageNotFoundException(String subject) {
        super("Not found: " + subject);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }
}
