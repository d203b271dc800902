package com.orbit.pipeline.adapter.file.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orbit.pipeline.core.contract.CacheEntry;
import com.orbit.pipeline.core.error.CacheException;
import com.orbit.pipeline.core.spi.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON 파일 기반 CacheStore.
 *
 * <p><strong>파일 구조:</strong></p>
 * <pre>
 * {dir}/
 *   live_dashboard_acmeco_structured.json
 *   live_dashboard_a%2Fb%3Ac_structured.json     // 키는 URL 인코딩
 * </pre>
 *
 * <p>쓰기는 임시 파일에 기록한 뒤 이동하므로 중간에 중단되어도 기존 파일이 깨지지 않습니다.
 * 읽을 수 없는 파일은 WARN 로그를 남기고 건너뜁니다.</p>
 *
 * @param <V> 값 타입
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class JsonFileCacheStore<V> implements CacheStore<V> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCacheStore.class);

    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Class<V> valueType;

    /**
     * @param directory 캐시 디렉터리 (없으면 생성)
     * @param mapper JSON 매퍼 ({@link CacheObjectMappers#create()} 권장)
     * @param valueType 값 타입
     * @throws CacheException 디렉터리를 만들 수 없는 경우
     */
    public JsonFileCacheStore(Path directory, ObjectMapper mapper, Class<V> valueType) {
        if (directory == null || mapper == null || valueType == null) {
            throw new IllegalArgumentException("directory, mapper and valueType cannot be null");
        }
        this.directory = directory;
        this.mapper = mapper;
        this.valueType = valueType;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheException("Failed to create cache directory: " + directory, e);
        }
    }

    @Override
    public void save(CacheEntry<V> entry) {
        CacheDocument document = new CacheDocument(
            entry.key(),
            mapper.valueToTree(entry.value()),
            entry.createdAt(),
            entry.expiresAt(),
            entry.hitCount(),
            entry.qualityTag(),
            entry.contentHash()
        );
        Path target = fileFor(entry.key());
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            Files.write(temp, mapper.writeValueAsBytes(document));
            move(temp, target);
        } catch (IOException e) {
            throw new CacheException("Failed to write cache entry: " + entry.key(), e);
        }
        log.debug("Cache entry written: key={}, file={}", entry.key(), target.getFileName());
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new CacheException("Failed to delete cache entry: " + key, e);
        }
    }

    @Override
    public List<CacheEntry<V>> loadAll() {
        List<CacheEntry<V>> entries = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                CacheEntry<V> entry = read(file);
                if (entry != null) {
                    entries.add(entry);
                }
            }
        } catch (IOException e) {
            throw new CacheException("Failed to list cache directory: " + directory, e);
        }
        log.debug("Loaded {} cache entries from {}", entries.size(), directory);
        return entries;
    }

    /**
     * 캐시 디렉터리.
     *
     * @return 디렉터리 경로
     */
    public Path getDirectory() {
        return directory;
    }

    private CacheEntry<V> read(Path file) {
        try {
            CacheDocument document = mapper.readValue(file.toFile(), CacheDocument.class);
            V value = mapper.treeToValue(document.value(), valueType);
            return new CacheEntry<>(
                document.key(),
                value,
                document.createdAt(),
                document.expiresAt(),
                document.hitCount(),
                document.qualityTag(),
                document.contentHash()
            );
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping unreadable cache file {}: {}", file.getFileName(), e.getMessage());
            return null;
        } catch (IOException e) {
            log.warn("Skipping cache file {} after read failure", file.getFileName(), e);
            return null;
        }
    }

    private Path fileFor(String key) {
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
