package org.seiscube.seismic;

import java.util.Objects;

/**
 * 对调用方可见的失败（带稳定错误码）。
 * <p>
 * {@link #getMessage()} 以错误码开头，例如 {@code out_of_range_index: ...}，便于 MCP 客户端按码处理。
 */
public class SeismicException extends RuntimeException {

    private final ErrorKind kind;
    private final String detail;

    public SeismicException(ErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public SeismicException(ErrorKind kind, String detail, Throwable cause) {
        super(Objects.requireNonNull(kind, "kind").code() + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String detail() {
        return detail;
    }
}
