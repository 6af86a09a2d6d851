package dev.kappalib.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Serves avatars written by the local storage provider. With S3 storage the bucket serves them.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "app.storage.type", havingValue = "local", matchIfMissing = true)
public class StaticResourceConfig {

    @Value("${app.storage.local.path:uploads}")
    private String uploadPath;

    @Bean
    public RouterFunction<ServerResponse> avatarRouter() {
        return RouterFunctions.route()
                .GET("/uploads/avatars/{filename}", request -> {
                    String filename = request.pathVariable("filename");

                    // Path traversal protection: resolved path must stay within the avatar directory
                    Path avatarRoot = Paths.get(uploadPath, "avatars").toAbsolutePath().normalize();
                    Path resolvedPath = avatarRoot.resolve(filename).normalize();
                    if (!resolvedPath.startsWith(avatarRoot) || !filename.endsWith(".jpg")) {
                        return ServerResponse.status(HttpStatus.FORBIDDEN).build();
                    }

                    Resource resource = new FileSystemResource(resolvedPath);
                    if (!resource.exists()) {
                        return ServerResponse.notFound().build();
                    }
                    return ServerResponse.ok()
                            .contentType(MediaType.IMAGE_JPEG)
                            .header(HttpHeaders.CACHE_CONTROL, "public, max-age=3600")
                            .bodyValue(resource);
                })
                .build();
    }
}
