package org.seiscube.seismic;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 地震数据体 MCP Server 的业务配置（{@code app.seismic.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #inputRoots} 指定允许加载 SEG-Y 文件的根目录白名单。</li>
 *   <li>通过缓存条目数、后台线程数与队列容量控制内存占用与后台写入压力。</li>
 *   <li>通过 {@link #store} 选择持久化存储（本地目录、S3、内存或不启用）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.seismic")
public class SeismicServerProperties {

    /**
     * 允许加载输入文件的根目录白名单；相对路径按第一个根目录解析。
     */
    @NotEmpty
    private List<String> inputRoots = List.of(".");

    /**
     * 单个输入文件（含 zip）的最大体积。
     */
    @NotNull
    private DataSize maxInputSize = DataSize.ofMegabytes(500);

    /**
     * 内存切片缓存的最大条目数（LRU）。
     */
    @Min(1)
    @Max(100_000)
    private int cacheMaxEntries = 200;

    /**
     * 后台持久化线程数。
     */
    @Min(1)
    @Max(64)
    private int workerThreads = 4;

    /**
     * 后台任务队列容量；队列满时新任务被丢弃并记录告警。
     */
    @Min(1)
    @Max(1_000_000)
    private int workerQueueCapacity = 1024;

    /**
     * 估算测网方向时最多采样的道数。
     */
    @Min(1)
    @Max(10_000_000)
    private int geometrySampleTraces = 1000;

    /**
     * 估算测网方向所需的最少有效坐标记录数，不足时使用缺省方向。
     */
    @Min(1)
    @Max(1_000_000)
    private int geometryMinRecords = 10;

    /**
     * 加载完成后是否在后台预热切片（计算并写入持久化存储）。
     */
    private boolean warmupEnabled = true;

    /**
     * 数据体不超过该体积时预热全部切片，否则只预热每个方向中心附近的切片。
     */
    @NotNull
    private DataSize warmupFullCacheMaxSize = DataSize.ofMegabytes(200);

    /**
     * 中心窗口半径：预热 [center - radius, center + radius]。
     */
    @Min(0)
    @Max(10_000)
    private int warmupCenterRadius = 2;

    @Valid
    @NotNull
    private Store store = new Store();

    public List<String> getInputRoots() {
        return inputRoots;
    }

    public void setInputRoots(List<String> inputRoots) {
        this.inputRoots = inputRoots;
    }

    public DataSize getMaxInputSize() {
        return maxInputSize;
    }

    public void setMaxInputSize(DataSize maxInputSize) {
        this.maxInputSize = maxInputSize;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getWorkerQueueCapacity() {
        return workerQueueCapacity;
    }

    public void setWorkerQueueCapacity(int workerQueueCapacity) {
        this.workerQueueCapacity = workerQueueCapacity;
    }

    public int getGeometrySampleTraces() {
        return geometrySampleTraces;
    }

    public void setGeometrySampleTraces(int geometrySampleTraces) {
        this.geometrySampleTraces = geometrySampleTraces;
    }

    public int getGeometryMinRecords() {
        return geometryMinRecords;
    }

    public void setGeometryMinRecords(int geometryMinRecords) {
        this.geometryMinRecords = geometryMinRecords;
    }

    public boolean isWarmupEnabled() {
        return warmupEnabled;
    }

    public void setWarmupEnabled(boolean warmupEnabled) {
        this.warmupEnabled = warmupEnabled;
    }

    public DataSize getWarmupFullCacheMaxSize() {
        return warmupFullCacheMaxSize;
    }

    public void setWarmupFullCacheMaxSize(DataSize warmupFullCacheMaxSize) {
        this.warmupFullCacheMaxSize = warmupFullCacheMaxSize;
    }

    public int getWarmupCenterRadius() {
        return warmupCenterRadius;
    }

    public void setWarmupCenterRadius(int warmupCenterRadius) {
        this.warmupCenterRadius = warmupCenterRadius;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    /**
     * 持久化存储配置（{@code app.seismic.store.*}）。
     */
    public static class Store {

        /**
         * 存储类型：filesystem / s3 / memory / none。
         */
        @NotNull
        @Pattern(regexp = "filesystem|s3|memory|none")
        private String type = "filesystem";

        /**
         * filesystem 类型的根目录。
         */
        @NotNull
        private String root = "./data/object-store";

        @Valid
        @NotNull
        private S3 s3 = new S3();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public S3 getS3() {
            return s3;
        }

        public void setS3(S3 s3) {
            this.s3 = s3;
        }
    }

    /**
     * S3 存储配置（{@code app.seismic.store.s3.*}）。
     * <p>
     * region/profile 为空时使用 AWS SDK 的默认解析链。
     */
    public static class S3 {

        private String bucket = "seismic-data";

        /**
         * 对象 key 前缀，例如 {@code prod/}。
         */
        private String prefix = "";

        private String region = "";

        private String profile = "";

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getProfile() {
            return profile;
        }

        public void setProfile(String profile) {
            this.profile = profile;
        }
    }
}
