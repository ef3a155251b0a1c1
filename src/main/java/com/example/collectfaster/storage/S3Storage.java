package com.example.collectfaster.storage;

import com.example.collectfaster.postprocess.HashedNamePostProcessor;
import com.example.collectfaster.postprocess.PostProcessor;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Stores collected files as objects in an S3 bucket, below a fixed key location.
 * The underlying {@link S3Client} is thread-safe and shared by all workers.
 */
public final class S3Storage implements StorageBackend, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3Storage.class);
    public static final String DEFAULT_LOCATION = "static";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final S3Client s3Client;
    private final String bucket;
    private final String location;
    private final boolean hashedNames;
    private final Tika tika = new Tika();

    public S3Storage(String bucket, String location, Optional<String> region, boolean hashedNames) {
        this(region
                        .map(Region::of)
                        .map(r -> S3Client.builder().region(r).build())
                        .orElseGet(() -> S3Client.builder().build()),
                bucket,
                location,
                hashedNames);
    }

    public S3Storage(S3Client s3Client, String bucket, String location, boolean hashedNames) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.location = normalizeLocation(location);
        this.hashedNames = hashedNames;
    }

    @Override
    public String describe() {
        return location.isEmpty() ? "s3://" + bucket : "s3://" + bucket + "/" + location;
    }

    @Override
    public boolean exists(String path) throws IOException {
        return head(path).isPresent();
    }

    @Override
    public Optional<Instant> modifiedTime(String path) throws IOException {
        return head(path).map(HeadObjectResponse::lastModified);
    }

    @Override
    public void copy(String sourcePath, String destinationPath, SourceLocation source) throws IOException {
        Path file = source.resolve(sourcePath);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        String key = keyFor(destinationPath);
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentTypeFor(destinationPath))
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromFile(file));
        } catch (SdkException ex) {
            throw new IOException("Failed to upload " + file + " to s3://" + bucket + "/" + key, ex);
        }
        LOGGER.debug("Uploaded {} to s3://{}/{}", file, bucket, key);
    }

    @Override
    public void link(String sourcePath, String destinationPath, SourceLocation source) throws IOException {
        throw new IOException("Can't symlink to a remote destination: " + describe());
    }

    @Override
    public void delete(String path) throws IOException {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(keyFor(path))
                .build();
        try {
            s3Client.deleteObject(request);
        } catch (SdkException ex) {
            throw new IOException("Failed to delete s3://" + bucket + "/" + keyFor(path), ex);
        }
    }

    @Override
    public InputStream open(String path) throws IOException {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(keyFor(path))
                .build();
        try {
            return s3Client.getObject(request);
        } catch (SdkException ex) {
            throw new IOException("Failed to read s3://" + bucket + "/" + keyFor(path), ex);
        }
    }

    @Override
    public void write(String path, byte[] content) throws IOException {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(keyFor(path))
                .contentType(contentTypeFor(path))
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException ex) {
            throw new IOException("Failed to write s3://" + bucket + "/" + keyFor(path), ex);
        }
    }

    @Override
    public Optional<PostProcessor> postProcessor() {
        return hashedNames ? Optional.of(new HashedNamePostProcessor(this)) : Optional.empty();
    }

    @Override
    public void close() {
        s3Client.close();
    }

    String keyFor(String path) {
        String normalized = path.replace("\\", "/").replaceAll("^/+", "");
        return location.isEmpty() ? normalized : location + "/" + normalized;
    }

    private Optional<HeadObjectResponse> head(String path) throws IOException {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(keyFor(path))
                .build();
        try {
            return Optional.of(s3Client.headObject(request));
        } catch (S3Exception ex) {
            if (ex.statusCode() == 404) {
                return Optional.empty();
            }
            throw new IOException("Failed to inspect s3://" + bucket + "/" + keyFor(path), ex);
        } catch (SdkException ex) {
            throw new IOException("Failed to inspect s3://" + bucket + "/" + keyFor(path), ex);
        }
    }

    private String contentTypeFor(String path) {
        String detected = tika.detect(path);
        return detected == null ? DEFAULT_CONTENT_TYPE : detected;
    }

    private String normalizeLocation(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("^/+", "").replaceAll("/+$", "");
    }
}
