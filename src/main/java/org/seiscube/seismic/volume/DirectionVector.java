package org.seiscube.seismic.volume;

/**
 * 二维方向向量（x 指向东，y 指向北）。
 */
public record DirectionVector(double x, double y) {

    public static final DirectionVector EAST = new DirectionVector(1.0, 0.0);
    public static final DirectionVector NORTH = new DirectionVector(0.0, 1.0);

    public double length() {
        return Math.hypot(x, y);
    }

    /**
     * @return 单位向量；长度为 0 时返回 null
     */
    public DirectionVector normalized() {
        double len = length();
        if (len == 0.0 || !Double.isFinite(len)) {
            return null;
        }
        return new DirectionVector(x / len, y / len);
    }

    public double dot(DirectionVector other) {
        return x * other.x + y * other.y;
    }

    /**
     * 逆时针旋转 90°：{@code (x, y) -> (-y, x)}。
     */
    public DirectionVector rotateLeft() {
        return new DirectionVector(-y, x);
    }

    /**
     * 顺时针旋转 90°：{@code (x, y) -> (y, -x)}。
     */
    public DirectionVector rotateRight() {
        return new DirectionVector(y, -x);
    }

    /**
     * 方位角：自正北顺时针的角度，范围 [0, 360)。
     */
    public double azimuthDegrees() {
        double degrees = Math.toDegrees(Math.atan2(x, y));
        double wrapped = degrees % 360.0;
        if (wrapped < 0) {
            wrapped += 360.0;
        }
        return wrapped >= 360.0 ? 0.0 : wrapped;
    }
}
