package org.seiscube.seismic.segy;

import org.seiscube.seismic.volume.TraceHeader;
import org.seiscube.seismic.volume.TraceStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * SEG-Y（rev 0/1，大端序）道数据读取器。
 * <p>
 * 文件结构：3200 字节文本头 + 400 字节二进制头 + N 个扩展文本头（每个 3200 字节）+ 道（240 字节道头 + 采样）。
 * 读取时不做几何推断（等价于“忽略几何”模式），道头中的 inline/crossline 由上层的网格映射处理。
 * <p>
 * 使用的字段（1 基字节位置）：
 * <ul>
 *   <li>二进制头：采样间隔 3217-3218（微秒）、每道采样数 3221-3222、格式码 3225-3226、扩展文本头个数 3505-3506。</li>
 *   <li>道头：SourceX/SourceY 73-80、延迟时间 109-110、采样数 115-116、采样间隔 117-118、
 *       CDP X/Y 181-188、inline 189-192、crossline 193-196。</li>
 * </ul>
 * CDP X 或 CDP Y 为 0 时改用 SourceX/SourceY；坐标缩放因子不参与计算（保留头信息原值）。
 * <p>
 * 非线程安全：同一实例只应在一个线程内顺序读取。
 */
public final class SegyFile implements TraceStream, Closeable {

    private static final Logger log = LoggerFactory.getLogger(SegyFile.class);

    static final int TEXT_HEADER_BYTES = 3200;
    static final int BINARY_HEADER_BYTES = 400;
    static final int TRACE_HEADER_BYTES = 240;
    private static final double DEFAULT_SAMPLE_INTERVAL_MS = 4.0;

    private final Path path;
    private final FileChannel channel;
    private final SegySampleFormat format;
    private final int sampleCount;
    private final int traceCount;
    private final long firstTraceOffset;
    private final long traceBytes;
    private final double[] samplePositions;
    private final ByteBuffer headerBuffer = ByteBuffer.allocate(TRACE_HEADER_BYTES).order(ByteOrder.BIG_ENDIAN);
    private final ByteBuffer sampleBuffer;

    private SegyFile(Path path, FileChannel channel, SegySampleFormat format, int sampleCount, int traceCount,
                     long firstTraceOffset, double[] samplePositions) {
        this.path = path;
        this.channel = channel;
        this.format = format;
        this.sampleCount = sampleCount;
        this.traceCount = traceCount;
        this.firstTraceOffset = firstTraceOffset;
        this.traceBytes = TRACE_HEADER_BYTES + (long) sampleCount * format.bytesPerSample();
        this.samplePositions = samplePositions;
        this.sampleBuffer = ByteBuffer.allocate(sampleCount * format.bytesPerSample()).order(ByteOrder.BIG_ENDIAN);
    }

    /**
     * 打开并校验 SEG-Y 文件。
     *
     * @throws SegyFormatException 文件头不完整、格式码不支持或采样数无效
     * @throws IOException         文件无法读取
     */
    public static SegyFile open(Path path) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            return open(path, channel);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    private static SegyFile open(Path path, FileChannel channel) throws IOException {
        long size = channel.size();
        if (size < TEXT_HEADER_BYTES + BINARY_HEADER_BYTES) {
            throw new SegyFormatException("文件过小，不是有效的 SEG-Y：" + size + " 字节");
        }
        ByteBuffer binary = ByteBuffer.allocate(BINARY_HEADER_BYTES).order(ByteOrder.BIG_ENDIAN);
        readFully(channel, binary, TEXT_HEADER_BYTES);

        int intervalUs = Short.toUnsignedInt(binary.getShort(16));
        int samples = Short.toUnsignedInt(binary.getShort(20));
        int formatCode = binary.getShort(24);
        int extendedHeaders = binary.getShort(304);

        SegySampleFormat format = SegySampleFormat.fromCode(formatCode);
        if (format == null) {
            throw new SegyFormatException("不支持的采样格式码：" + formatCode);
        }
        if (extendedHeaders < 0) {
            log.warn("扩展文本头个数为 {}（可变长度），按 0 处理：{}", extendedHeaders, path);
            extendedHeaders = 0;
        }
        long firstTraceOffset = TEXT_HEADER_BYTES + BINARY_HEADER_BYTES + (long) extendedHeaders * TEXT_HEADER_BYTES;

        // 二进制头缺少采样数/采样间隔时，尝试使用第一道道头中的值
        ByteBuffer firstHeader = null;
        if (size >= firstTraceOffset + TRACE_HEADER_BYTES) {
            firstHeader = ByteBuffer.allocate(TRACE_HEADER_BYTES).order(ByteOrder.BIG_ENDIAN);
            readFully(channel, firstHeader, firstTraceOffset);
        }
        if (samples == 0 && firstHeader != null) {
            samples = Short.toUnsignedInt(firstHeader.getShort(114));
        }
        if (samples <= 0) {
            throw new SegyFormatException("每道采样数为 0，无法解析数据");
        }
        if (intervalUs == 0 && firstHeader != null) {
            intervalUs = Short.toUnsignedInt(firstHeader.getShort(116));
        }
        double intervalMs = intervalUs > 0 ? intervalUs / 1000.0 : DEFAULT_SAMPLE_INTERVAL_MS;
        double delayMs = firstHeader != null ? firstHeader.getShort(108) : 0.0;

        long traceBytes = TRACE_HEADER_BYTES + (long) samples * format.bytesPerSample();
        long traceArea = Math.max(0, size - firstTraceOffset);
        long traces = traceArea / traceBytes;
        if (traceArea % traceBytes != 0) {
            log.warn("道数据区长度不是单道长度的整数倍，末尾 {} 字节已忽略：{}", traceArea % traceBytes, path);
        }
        if (traces > Integer.MAX_VALUE) {
            throw new SegyFormatException("道数量过大：" + traces);
        }

        double[] samplePositions = new double[samples];
        for (int i = 0; i < samples; i++) {
            samplePositions[i] = delayMs + i * intervalMs;
        }
        return new SegyFile(path, channel, format, samples, (int) traces, firstTraceOffset, samplePositions);
    }

    public Path path() {
        return path;
    }

    public SegySampleFormat format() {
        return format;
    }

    @Override
    public int traceCount() {
        return traceCount;
    }

    @Override
    public int sampleCount() {
        return sampleCount;
    }

    @Override
    public double[] samplePositions() {
        return samplePositions.clone();
    }

    @Override
    public TraceHeader header(int traceIndex) throws IOException {
        checkIndex(traceIndex);
        headerBuffer.clear();
        readFully(channel, headerBuffer, traceOffset(traceIndex));

        int inline = headerBuffer.getInt(188);
        int crossline = headerBuffer.getInt(192);
        int x = headerBuffer.getInt(180);
        int y = headerBuffer.getInt(184);
        if (x == 0 || y == 0) {
            x = headerBuffer.getInt(72);
            y = headerBuffer.getInt(76);
        }
        if (x == 0 || y == 0) {
            return TraceHeader.withoutPosition(inline, crossline);
        }
        return new TraceHeader(inline, crossline, (double) x, (double) y);
    }

    @Override
    public float[] amplitudes(int traceIndex) throws IOException {
        checkIndex(traceIndex);
        sampleBuffer.clear();
        readFully(channel, sampleBuffer, traceOffset(traceIndex) + TRACE_HEADER_BYTES);
        sampleBuffer.flip();
        float[] out = new float[sampleCount];
        for (int i = 0; i < sampleCount; i++) {
            out[i] = format.read(sampleBuffer);
        }
        return out;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private long traceOffset(int traceIndex) {
        return firstTraceOffset + traceIndex * traceBytes;
    }

    private void checkIndex(int traceIndex) {
        if (traceIndex < 0 || traceIndex >= traceCount) {
            throw new IndexOutOfBoundsException("道序号越界：" + traceIndex + "（共 " + traceCount + " 道）");
        }
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long pos = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, pos);
            if (read < 0) {
                throw new EOFException("读取到文件末尾：position=" + pos);
            }
            pos += read;
        }
    }
}
