package com.fisheye.vision.core.storage;

import com.fisheye.vision.exception.ArtifactNotFoundException;
import com.fisheye.vision.exception.TransientStorageException;
import com.fisheye.vision.util.RetrySupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 本地文件系统存储
 * <p>
 * 地址 local://bucket/key 映射到 root/bucket/key。
 * 写入先落临时文件再原子替换，读到的对象要么完整要么不存在
 */
public class LocalArtifactStorage implements ArtifactStorage {
    private static final Logger logger = LoggerFactory.getLogger(LocalArtifactStorage.class);

    public static final String SCHEME = "local";

    private final Path root;
    private final int maxAttempts;
    private final long backoffMillis;

    public LocalArtifactStorage(Path root, int maxAttempts, long backoffMillis) {
        this.root = root.toAbsolutePath().normalize();
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create storage root: " + this.root, e);
        }
        logger.info("Local artifact storage rooted at {}", this.root);
    }

    @Override
    public byte[] getImage(String location) {
        StorageUri uri = StorageUri.parse(location);
        Path path = resolve(uri);
        return withRetry("Read " + uri, uri, () -> Files.readAllBytes(path));
    }

    @Override
    public String putImage(byte[] jpeg, String location) {
        return write(jpeg, location);
    }

    @Override
    public String putJson(String json, String location) {
        return write(json.getBytes(StandardCharsets.UTF_8), location);
    }

    @Override
    public String getText(String location) {
        StorageUri uri = StorageUri.parse(location);
        Path path = resolve(uri);
        return withRetry("Read " + uri, uri, () -> Files.readString(path, StandardCharsets.UTF_8));
    }

    @Override
    public String putText(String text, String location) {
        return write(text.getBytes(StandardCharsets.UTF_8), location);
    }

    @Override
    public List<String> list(String prefix) {
        StorageUri uri = StorageUri.parsePrefix(prefix);
        String key = uri.getKey();
        int slash = key.lastIndexOf('/');
        String dirKey = slash < 0 ? "" : key.substring(0, slash);
        String namePrefix = key.substring(slash + 1);
        Path dir = resolve(new StorageUri(uri.getScheme(), uri.getBucket(), dirKey));
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        String base = dirKey.isEmpty() ? "" : dirKey + "/";
        return withRetry("List " + uri, uri, () -> {
            try (Stream<Path> files = Files.list(dir)) {
                return files.filter(Files::isRegularFile)
                        .map(p -> p.getFileName().toString())
                        .filter(name -> name.startsWith(namePrefix))
                        .sorted()
                        .map(name -> new StorageUri(uri.getScheme(), uri.getBucket(), base + name).toString())
                        .collect(Collectors.toList());
            }
        });
    }

    private String write(byte[] bytes, String location) {
        StorageUri uri = StorageUri.parse(location);
        Path path = resolve(uri);
        withRetry("Write " + uri, uri, () -> {
            Files.createDirectories(path.getParent());
            Path temp = Files.createTempFile(path.getParent(), ".upload-", ".tmp");
            try {
                Files.write(temp, bytes);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            return null;
        });
        logger.debug("Stored {} bytes at {}", bytes.length, uri);
        return uri.toString();
    }

    /**
     * 地址映射到本地路径，拒绝其他 scheme 和越出根目录的 key
     */
    Path resolve(StorageUri uri) {
        if (!SCHEME.equals(uri.getScheme())) {
            throw new IllegalArgumentException("Unsupported storage scheme '" + uri.getScheme()
                    + "', expected '" + SCHEME + "'");
        }
        Path path = root.resolve(uri.getBucket()).resolve(uri.getKey()).normalize();
        if (!path.startsWith(root.resolve(uri.getBucket()))) {
            throw new IllegalArgumentException("Storage key escapes bucket: " + uri);
        }
        return path;
    }

    private <T> T withRetry(String operation, StorageUri uri, RetrySupport.Attempt<T> attempt) {
        try {
            return RetrySupport.execute(operation, maxAttempts, backoffMillis,
                    LocalArtifactStorage::isTransient, attempt);
        } catch (NoSuchFileException | FileNotFoundException e) {
            throw new ArtifactNotFoundException(uri.toString(), e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new TransientStorageException(operation + " failed after " + maxAttempts + " attempts: "
                    + e.getMessage(), e);
        }
    }

    private static boolean isTransient(Exception e) {
        return e instanceof IOException
                && !(e instanceof NoSuchFileException)
                && !(e instanceof FileNotFoundException)
                && !(e instanceof AccessDeniedException);
    }

    public Path getRoot() { return root; }
}
