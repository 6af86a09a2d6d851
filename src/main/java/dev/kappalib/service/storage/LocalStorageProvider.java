package dev.kappalib.service.storage;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Local filesystem storage provider for development.
 * Objects are written under the configured upload directory; Cache-Control metadata is not kept.
 */
@Slf4j
public class LocalStorageProvider implements StorageProvider {

    private final Path uploadRoot;
    private final String publicUrl;

    public LocalStorageProvider(String uploadPath, String publicUrl) {
        this.uploadRoot = Paths.get(uploadPath).toAbsolutePath().normalize();
        this.publicUrl = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
        log.info("LocalStorageProvider initialized: uploadPath={}", uploadRoot);
    }

    @Override
    public Mono<String> store(String key, byte[] data, String contentType, String cacheControl) {
        return Mono.fromCallable(() -> {
            Path filePath = resolve(key);
            Files.createDirectories(filePath.getParent());
            Files.write(filePath, data);
            log.info("File stored locally: {} ({} bytes)", filePath, data.length);
            return getUrl(key);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromCallable(() -> {
            Path filePath = resolve(key);
            boolean deleted = Files.deleteIfExists(filePath);
            if (deleted) {
                log.info("File deleted: {}", filePath);
            } else {
                log.debug("File not found for deletion: {}", filePath);
            }
            return deleted;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public String getUrl(String key) {
        return publicUrl + "/" + key;
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.fromCallable(() -> {
            if (!Files.exists(uploadRoot)) {
                Files.createDirectories(uploadRoot);
            }
            return Files.isWritable(uploadRoot);
        }).subscribeOn(Schedulers.boundedElastic())
          .onErrorReturn(false);
    }

    @Override
    public String getType() {
        return "LOCAL";
    }

    private Path resolve(String key) throws IOException {
        Path filePath = uploadRoot.resolve(key).normalize();
        // Prevent path traversal
        if (!filePath.startsWith(uploadRoot)) {
            log.warn("Path traversal attempt blocked in LocalStorageProvider: {}", key);
            throw new IOException("Invalid storage key");
        }
        return filePath;
    }
}
