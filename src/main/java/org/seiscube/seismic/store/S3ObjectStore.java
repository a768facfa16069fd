package org.seiscube.seismic.store;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.auth.profile.ProfileCredentialsProvider;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.amazonaws.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * AWS S3 版对象存储（AWS SDK for Java v1）。
 * <p>
 * 所有 key 都放在 {@code bucket/prefix/} 下；{@link #list(String)} 返回时会去掉 prefix，
 * 调用方看到的 key 与其它实现一致。
 */
public class S3ObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

    private final AmazonS3 s3;
    private final String bucket;
    private final String keyPrefix;
    private final boolean available;

    public S3ObjectStore(AmazonS3 s3, String bucket, String prefix) {
        this.s3 = s3;
        this.bucket = bucket;
        this.keyPrefix = normalizePrefix(prefix);
        this.available = checkBucket(s3, bucket);
    }

    /**
     * 按配置创建客户端：指定 profile 时读取 {@code ~/.aws/credentials} 中的该 profile，否则使用默认凭证链。
     * 客户端创建失败时返回不可用的存储（持久化降级为空操作）。
     */
    public static ObjectStore connect(String bucket, String prefix, String region, String profile) {
        try {
            AWSCredentialsProvider credentials = (profile == null || profile.isBlank())
                    ? DefaultAWSCredentialsProviderChain.getInstance()
                    : new ProfileCredentialsProvider(profile);
            AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard().withCredentials(credentials);
            if (region != null && !region.isBlank() && !"default".equals(region)) {
                builder = builder.withRegion(region);
            }
            return new S3ObjectStore(builder.build(), bucket, prefix);
        } catch (SdkClientException | IllegalArgumentException e) {
            log.warn("S3 客户端创建失败，持久化将被跳过：{}", e.getMessage());
            return new UnavailableObjectStore("s3");
        }
    }

    @Override
    public String kind() {
        return "s3";
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public boolean put(String key, byte[] bytes, String contentType) {
        if (!available || key == null || bytes == null) {
            return false;
        }
        ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentLength(bytes.length);
        metadata.setContentType(contentType == null ? CONTENT_TYPE_BINARY : contentType);
        try (InputStream in = new ByteArrayInputStream(bytes)) {
            s3.putObject(bucket, fullKey(key), in, metadata);
            return true;
        } catch (SdkClientException | IOException e) {
            log.warn("上传对象到 S3 失败：{}（{}）", key, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        if (!available || key == null) {
            return Optional.empty();
        }
        try (S3Object object = s3.getObject(bucket, fullKey(key))) {
            return Optional.of(IOUtils.toByteArray(object.getObjectContent()));
        } catch (AmazonServiceException e) {
            if (e.getStatusCode() != 404) {
                log.warn("从 S3 读取对象失败：{}（{}）", key, e.getMessage());
            }
            return Optional.empty();
        } catch (SdkClientException | IOException e) {
            log.warn("从 S3 读取对象失败：{}（{}）", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<String> list(String prefix) {
        if (!available) {
            return List.of();
        }
        List<String> keys = new ArrayList<>();
        ListObjectsV2Request request = new ListObjectsV2Request()
                .withBucketName(bucket)
                .withPrefix(fullKey(prefix == null ? "" : prefix));
        try {
            ListObjectsV2Result result;
            do {
                result = s3.listObjectsV2(request);
                for (S3ObjectSummary summary : result.getObjectSummaries()) {
                    String key = summary.getKey();
                    if (key.startsWith(keyPrefix)) {
                        keys.add(key.substring(keyPrefix.length()));
                    }
                }
                request.setContinuationToken(result.getNextContinuationToken());
            } while (result.isTruncated());
        } catch (SdkClientException e) {
            log.warn("列出 S3 对象失败：prefix={}（{}）", prefix, e.getMessage());
            return List.of();
        }
        keys.sort(null);
        return keys;
    }

    @Override
    public List<String> deletePrefix(String prefix) {
        List<String> deleted = new ArrayList<>();
        for (String key : list(prefix)) {
            try {
                s3.deleteObject(bucket, fullKey(key));
                deleted.add(key);
            } catch (SdkClientException e) {
                log.warn("删除 S3 对象失败：{}（{}）", key, e.getMessage());
            }
        }
        return deleted;
    }

    @Override
    public boolean exists(String key) {
        if (!available || key == null) {
            return false;
        }
        try {
            return s3.doesObjectExist(bucket, fullKey(key));
        } catch (SdkClientException e) {
            return false;
        }
    }

    private String fullKey(String key) {
        return keyPrefix + key;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        String p = prefix.trim();
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return p.endsWith("/") || p.isEmpty() ? p : p + "/";
    }

    private static boolean checkBucket(AmazonS3 s3, String bucket) {
        if (s3 == null || bucket == null || bucket.isBlank()) {
            return false;
        }
        try {
            boolean exists = s3.doesBucketExistV2(bucket);
            if (!exists) {
                log.warn("S3 bucket 不存在，持久化将被跳过：{}", bucket);
            }
            return exists;
        } catch (SdkClientException e) {
            log.warn("无法访问 S3 bucket {}，持久化将被跳过：{}", bucket, e.getMessage());
            return false;
        }
    }
}
