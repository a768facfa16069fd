package org.seiscube.mcp;

import org.seiscube.seismic.ErrorKind;
import org.seiscube.seismic.InputPathResolver;
import org.seiscube.seismic.SeismicException;
import org.seiscube.seismic.SeismicServerProperties;
import org.seiscube.seismic.SeismicSession;
import org.seiscube.seismic.dto.CubeDeleteResult;
import org.seiscube.seismic.dto.CubeInfo;
import org.seiscube.seismic.dto.CubeListResult;
import org.seiscube.seismic.dto.CubeMetadataDocument;
import org.seiscube.seismic.dto.LoadResult;
import org.seiscube.seismic.dto.SessionStatus;
import org.seiscube.seismic.dto.SliceResult;
import org.seiscube.seismic.volume.SliceAxis;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 地震数据体 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>加载 SEG-Y（{@code seismic_load}），查看概要（{@code seismic_cube_info}）。</li>
 *   <li>按方向与下标取切片（{@code seismic_get_slice}），可选 gzip + Base64 压缩返回。</li>
 *   <li>管理已持久化的数据体（{@code seismic_list_cubes}、{@code seismic_get_cube}、{@code seismic_delete_cube}）。</li>
 *   <li>查看会话状态（{@code seismic_status}）。</li>
 * </ul>
 * <p>
 * 失败以 {@link SeismicException} 抛出，消息以错误码开头（例如 {@code out_of_range_index: ...}）。
 */
@Component
public class SeismicMcpTools {

    private final SeismicSession session;
    private final InputPathResolver pathResolver;
    private final SeismicServerProperties properties;

    public SeismicMcpTools(SeismicSession session, InputPathResolver pathResolver, SeismicServerProperties properties) {
        this.session = session;
        this.pathResolver = pathResolver;
        this.properties = properties;
    }

    @Tool(
            name = "seismic_load",
            description = "加载 SEG-Y 文件（.segy/.sgy，或包含 SEG-Y 的 .zip），构建三维数据体并替换当前数据体；返回 cube_id、形状、振幅统计与测网方向。"
    )
    public LoadResult load(
            @ToolParam(description = "文件路径（相对第一个输入根目录，或位于 app.seismic.input-roots 内的绝对路径）") String path
    ) {
        Path file = pathResolver.resolve(path);
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new SeismicException(ErrorKind.INVALID_REQUEST, "无法读取文件大小：" + path, e);
        }
        long maxBytes = properties.getMaxInputSize().toBytes();
        if (size > maxBytes) {
            throw new SeismicException(ErrorKind.INVALID_REQUEST,
                    "文件过大：" + size + " 字节（上限 " + maxBytes + " 字节，app.seismic.max-input-size）");
        }
        return session.load(file);
    }

    @Tool(
            name = "seismic_cube_info",
            description = "返回当前数据体概要：形状、inline/crossline/采样轴范围、振幅统计、内存占用与测网方向。"
    )
    public CubeInfo cubeInfo() {
        return session.cubeInfo()
                .orElseThrow(() -> new SeismicException(ErrorKind.NO_CUBE_LOADED, "尚未加载数据体，请先调用 seismic_load"));
    }

    @Tool(
            name = "seismic_get_slice",
            description = "获取当前数据体的二维切片：inline/crossline 切片行为采样轴、列为另一水平轴；sample 切片行为 inline、列为 crossline。"
    )
    public SliceResult getSlice(
            @ToolParam(description = "切片方向：inline / crossline（或 xline）/ sample") String axis,
            @ToolParam(description = "下标，从 0 开始（必须小于该方向的长度）") int index,
            @ToolParam(required = false, description = "是否以 gzip + Base64 返回完整 JSON 载荷（默认 false）") Boolean compressed
    ) {
        SliceAxis sliceAxis = SliceAxis.parse(axis);
        return session.getSlice(sliceAxis, index).toResult(Boolean.TRUE.equals(compressed));
    }

    @Tool(
            name = "seismic_list_cubes",
            description = "列出持久化存储中的数据体（按创建时间倒序），并标记当前会话正在使用的数据体。"
    )
    public CubeListResult listCubes() {
        return session.listCubes();
    }

    @Tool(
            name = "seismic_get_cube",
            description = "读取指定数据体的持久化元数据（filename、cube_id、cube_info、created_at、updated_at）。"
    )
    public CubeMetadataDocument getCube(
            @ToolParam(description = "数据体 ID（可从 seismic_list_cubes 获取）") String cubeId
    ) {
        return session.getCube(cubeId);
    }

    @Tool(
            name = "seismic_delete_cube",
            description = "删除指定数据体的全部持久化对象（元数据与切片），并清除其内存缓存切片。"
    )
    public CubeDeleteResult deleteCube(
            @ToolParam(description = "数据体 ID（可从 seismic_list_cubes 获取）") String cubeId
    ) {
        return session.delete(cubeId);
    }

    @Tool(
            name = "seismic_status",
            description = "返回会话状态：是否已加载数据体、持久化存储是否可用、缓存占用与后台任务计数。"
    )
    public SessionStatus status() {
        return session.status();
    }
}
