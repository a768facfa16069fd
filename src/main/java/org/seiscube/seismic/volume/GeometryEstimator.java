package org.seiscube.seismic.volume;

import org.seiscube.seismic.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToIntFunction;

/**
 * 根据道头坐标估算 inline/crossline 轴的地理方向与方位角。
 * <p>
 * 算法：
 * <ol>
 *   <li>只取前 {@code sampleLimit} 条道中 inline/crossline 与坐标都有效（非 0）的记录。</li>
 *   <li>按 crossline 分组、组内按 inline 排序，取首尾两点的单位向量作为一个“inline 方向”样本；
 *       按 inline 分组同理得到“crossline 方向”样本。</li>
 *   <li>各自求平均并归一化。两者点积绝对值大于 {@value #PERPENDICULAR_TOLERANCE} 时，
 *       crossline 方向改为 inline 方向逆时针旋转 90°。</li>
 *   <li>一侧没有样本时由另一侧旋转 90° 得到；两侧都没有或有效记录不足 {@code minRecords} 时返回缺省几何。</li>
 * </ol>
 */
public class GeometryEstimator {

    private static final Logger log = LoggerFactory.getLogger(GeometryEstimator.class);

    static final double PERPENDICULAR_TOLERANCE = 0.1;

    private final int sampleLimit;
    private final int minRecords;

    public GeometryEstimator() {
        this(1000, 10);
    }

    public GeometryEstimator(int sampleLimit, int minRecords) {
        this.sampleLimit = Math.max(1, sampleLimit);
        this.minRecords = Math.max(1, minRecords);
    }

    public SurveyGeometry estimate(List<TraceHeader> headers) {
        List<TraceHeader> records = new ArrayList<>();
        int limit = Math.min(headers.size(), sampleLimit);
        for (int i = 0; i < limit; i++) {
            TraceHeader header = headers.get(i);
            if (header != null && header.hasGridPosition() && header.hasPosition()) {
                records.add(header);
            }
        }
        if (records.size() < minRecords) {
            log.info("有效坐标记录不足（{} < {}，{}），使用缺省测网方向",
                    records.size(), minRecords, ErrorKind.INSUFFICIENT_GEOMETRY_DATA.code());
            return SurveyGeometry.assumed(records.size());
        }

        // 同一 crossline 上沿 inline 递增的方向即 inline 方向，反之亦然
        DirectionVector inline = averageDirection(records, TraceHeader::crossline, TraceHeader::inline);
        DirectionVector crossline = averageDirection(records, TraceHeader::inline, TraceHeader::crossline);

        if (inline == null && crossline == null) {
            log.info("坐标记录无法构成方向样本（{}），使用缺省测网方向", ErrorKind.INSUFFICIENT_GEOMETRY_DATA.code());
            return SurveyGeometry.assumed(records.size());
        }
        if (inline == null) {
            inline = crossline.rotateRight();
        } else if (crossline == null) {
            crossline = inline.rotateLeft();
        } else if (Math.abs(inline.dot(crossline)) > PERPENDICULAR_TOLERANCE) {
            crossline = inline.rotateLeft().normalized();
        }

        double inlineAzimuth = inline.azimuthDegrees();
        double crosslineAzimuth = crossline.azimuthDegrees();
        return new SurveyGeometry(
                inline,
                crossline,
                inlineAzimuth,
                crosslineAzimuth,
                crosslineAzimuth,
                classify(records),
                true,
                records.size()
        );
    }

    private static DirectionVector averageDirection(List<TraceHeader> records,
                                                    ToIntFunction<TraceHeader> groupBy,
                                                    ToIntFunction<TraceHeader> orderBy) {
        Map<Integer, List<TraceHeader>> groups = new TreeMap<>();
        for (TraceHeader record : records) {
            groups.computeIfAbsent(groupBy.applyAsInt(record), k -> new ArrayList<>()).add(record);
        }
        double sumX = 0;
        double sumY = 0;
        int samples = 0;
        for (List<TraceHeader> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            group.sort(Comparator.comparingInt(orderBy));
            TraceHeader first = group.get(0);
            TraceHeader last = group.get(group.size() - 1);
            DirectionVector unit = new DirectionVector(
                    last.positionX() - first.positionX(),
                    last.positionY() - first.positionY()
            ).normalized();
            if (unit == null) {
                continue;
            }
            sumX += unit.x();
            sumY += unit.y();
            samples++;
        }
        if (samples == 0) {
            return null;
        }
        return new DirectionVector(sumX / samples, sumY / samples).normalized();
    }

    static CoordinateSystem classify(List<TraceHeader> records) {
        double sumAbs = 0;
        double maxAbsX = 0;
        double maxAbsY = 0;
        for (TraceHeader record : records) {
            double ax = Math.abs(record.positionX());
            double ay = Math.abs(record.positionY());
            sumAbs += ax + ay;
            maxAbsX = Math.max(maxAbsX, ax);
            maxAbsY = Math.max(maxAbsY, ay);
        }
        double meanAbs = sumAbs / (2.0 * records.size());
        if (meanAbs > 100_000) {
            return CoordinateSystem.UTM;
        }
        if (meanAbs > 10_000) {
            return CoordinateSystem.LOCAL_GRID;
        }
        if (maxAbsX < 180 && maxAbsY < 90) {
            return CoordinateSystem.GEOGRAPHIC;
        }
        return CoordinateSystem.UNKNOWN;
    }
}
