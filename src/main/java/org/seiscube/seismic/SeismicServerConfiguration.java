package org.seiscube.seismic;

import org.seiscube.seismic.store.FileSystemObjectStore;
import org.seiscube.seismic.store.InMemoryObjectStore;
import org.seiscube.seismic.store.ObjectStore;
import org.seiscube.seismic.store.S3ObjectStore;
import org.seiscube.seismic.store.UnavailableObjectStore;
import org.seiscube.seismic.volume.CubeBuilder;
import org.seiscube.seismic.volume.GeometryEstimator;
import org.seiscube.seismic.volume.GridMapper;
import org.seiscube.seismic.volume.SliceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * 地震数据体服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把配置 {@link SeismicServerProperties} 注入到存储、缓存、后台线程池与会话中。</li>
 *   <li>存储按 {@code app.seismic.store.type} 选择实现；连接失败时退化为不可用存储，服务仍可在内存中工作。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class SeismicServerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SeismicServerConfiguration.class);

    @Bean
    public ObjectStore objectStore(SeismicServerProperties properties) {
        SeismicServerProperties.Store store = properties.getStore();
        ObjectStore objectStore = switch (store.getType()) {
            case "filesystem" -> new FileSystemObjectStore(Path.of(store.getRoot()));
            case "s3" -> S3ObjectStore.connect(
                    store.getS3().getBucket(),
                    store.getS3().getPrefix(),
                    store.getS3().getRegion(),
                    store.getS3().getProfile()
            );
            case "memory" -> new InMemoryObjectStore();
            case "none" -> new UnavailableObjectStore();
            default -> throw new IllegalArgumentException("不支持的存储类型：" + store.getType());
        };
        log.info("持久化存储：{}（可用：{}）", objectStore.kind(), objectStore.isAvailable());
        return objectStore;
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public BackgroundWorkerPool backgroundWorkerPool(SeismicServerProperties properties) {
        return new BackgroundWorkerPool("seismic-persist", properties.getWorkerThreads(), properties.getWorkerQueueCapacity());
    }

    @Bean
    public SliceCache sliceCache(SeismicServerProperties properties) {
        return new SliceCache(properties.getCacheMaxEntries());
    }

    @Bean
    public PersistenceBridge persistenceBridge(ObjectStore objectStore, BackgroundWorkerPool backgroundWorkerPool) {
        return new PersistenceBridge(objectStore, backgroundWorkerPool);
    }

    @Bean
    public InputPathResolver inputPathResolver(SeismicServerProperties properties) {
        return new InputPathResolver(properties.getInputRoots());
    }

    @Bean
    public SeismicSession seismicSession(SeismicServerProperties properties,
                                         SliceCache sliceCache,
                                         PersistenceBridge persistenceBridge,
                                         BackgroundWorkerPool backgroundWorkerPool) {
        SeismicSession.Options options = new SeismicSession.Options(
                properties.isWarmupEnabled(),
                properties.getWarmupFullCacheMaxSize().toBytes(),
                properties.getWarmupCenterRadius()
        );
        return new SeismicSession(
                options,
                new CubeBuilder(new GridMapper()),
                new GeometryEstimator(properties.getGeometrySampleTraces(), properties.getGeometryMinRecords()),
                new SliceExtractor(),
                sliceCache,
                persistenceBridge,
                backgroundWorkerPool
        );
    }
}
