package org.seiscube.seismic.volume;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 根据坐标量级粗略判断的坐标系类别。
 */
public enum CoordinateSystem {

    UTM("UTM"),
    LOCAL_GRID("local-grid"),
    GEOGRAPHIC("geographic"),
    UNKNOWN("unknown"),
    ASSUMED("assumed");

    private final String label;

    CoordinateSystem(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static CoordinateSystem fromLabel(String label) {
        for (CoordinateSystem value : values()) {
            if (value.label.equalsIgnoreCase(label)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
