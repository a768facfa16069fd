package org.seiscube.seismic;

/**
 * 错误类别（对外稳定的错误码）。
 * <p>
 * {@link #HEADER_FIELD_ERROR} 与 {@link #INSUFFICIENT_GEOMETRY_DATA} 只在内部通过回退策略恢复，
 * 以告警和日志的形式出现（消息中带错误码），不会作为 {@link SeismicException} 抛给调用方。
 */
public enum ErrorKind {

    FORMAT_ERROR("format_error"),
    HEADER_FIELD_ERROR("header_field_error"),
    INSUFFICIENT_GEOMETRY_DATA("insufficient_geometry_data"),
    OUT_OF_RANGE_INDEX("out_of_range_index"),
    STORE_UNAVAILABLE("store_unavailable"),
    NOT_FOUND("not_found"),
    NO_CUBE_LOADED("no_cube_loaded"),
    INVALID_REQUEST("invalid_request");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
