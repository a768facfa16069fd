package org.seiscube.seismic.dto;

import java.util.List;

/**
 * 切片坐标：x 对应列，y 对应行。
 */
public record SliceCoordinates(List<Number> x, List<Number> y) {
}
