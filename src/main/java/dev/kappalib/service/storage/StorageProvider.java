package dev.kappalib.service.storage;

import reactor.core.publisher.Mono;

/**
 * Abstraction for object storage backends holding user uploads (avatars).
 * Implementations: LocalStorageProvider (filesystem), S3StorageProvider (S3-compatible: MinIO, Cloudflare R2, AWS S3).
 */
public interface StorageProvider {

    /**
     * Store an object, replacing any previous object under the same key.
     *
     * @param key          the storage key (e.g., "avatars/usr_ab12cd34.jpg")
     * @param data         the object bytes
     * @param contentType  the MIME type
     * @param cacheControl value for the Cache-Control metadata, may be null
     * @return the public URL of the stored object
     */
    Mono<String> store(String key, byte[] data, String contentType, String cacheControl);

    /**
     * Delete an object by its storage key.
     */
    Mono<Void> delete(String key);

    /**
     * Public URL for a given storage key.
     */
    String getUrl(String key);

    /**
     * @return true if the provider is operational
     */
    Mono<Boolean> isHealthy();

    /**
     * @return the storage type identifier ("LOCAL", "S3")
     */
    String getType();
}
