package com.xingest.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xingest.core.util.ScrapeClock;
import com.xingest.core.util.ScrapeJson;
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
import java.time.Duration;
import java.util.Objects;

/**
 * 디렉터리 기반 캐시: 키 1개 = JSON 파일 1개 ({v,key,createdAt,expiresAt,result}).
 * - 디렉터리는 첫 사용 시 생성
 * - 쓰기는 tmp 파일에 쓴 뒤 원자적 move (읽는 쪽은 이전 값 또는 새 값만 본다)
 * - I/O 오류, 손상 파일은 CacheException
 */
public final class FileScrapeCache extends AbstractScrapeCache {
    private static final Logger LOG = LoggerFactory.getLogger(FileScrapeCache.class);

    private static final String EXT = ".json";
    private static final String TMP_EXT = ".tmp";

    private final Path dir;
    private final ObjectMapper om = ScrapeJson.mapper();
    private boolean dirReady;

    public FileScrapeCache(Path dir) {
        this(dir, ScrapeClock.SYSTEM, DEFAULT_TTL);
    }

    public FileScrapeCache(Path dir, Duration defaultTtl) {
        this(dir, ScrapeClock.SYSTEM, defaultTtl);
    }

    public FileScrapeCache(Path dir, ScrapeClock clock, Duration defaultTtl) {
        super(clock, defaultTtl);
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    public Path getDir() { return dir; }

    /** 정규화 키 → 파일명. 키는 이미 소문자. */
    static String fileName(String key) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8) + EXT;
    }

    Path fileFor(String key) {
        return dir.resolve(fileName(key));
    }

    @Override
    protected CacheEntry load(String key) {
        Path f = fileFor(key);
        if (!Files.isRegularFile(f)) return null;
        return read(f);
    }

    private CacheEntry read(Path f) {
        CacheEntry e;
        try {
            e = om.readValue(f.toFile(), CacheEntry.class);
        } catch (IOException ex) {
            throw new CacheException("Unreadable cache entry: " + f, ex);
        }
        if (e == null || !CacheEntry.VERSION.equals(e.v)) {
            throw new CacheException("Unsupported cache entry version in " + f + ": " + (e == null ? null : e.v));
        }
        return e;
    }

    @Override
    protected void store(String key, CacheEntry entry) {
        ensureDir();
        Path target = fileFor(key);
        Path tmp = target.resolveSibling(target.getFileName().toString() + TMP_EXT);
        try {
            om.writeValue(tmp.toFile(), entry);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CacheException("Failed to write cache entry: " + target, e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    protected boolean remove(String key) {
        try {
            return Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new CacheException("Failed to delete cache entry for " + key, e);
        }
    }

    @Override
    protected void removeAll() {
        if (!Files.isDirectory(dir)) return;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + EXT)) {
            for (Path f : ds) Files.deleteIfExists(f);
        } catch (IOException e) {
            throw new CacheException("Failed to clear cache dir: " + dir, e);
        }
    }

    @Override
    protected int sweep(long nowMillis) {
        if (!Files.isDirectory(dir)) return 0;
        int removed = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + EXT)) {
            for (Path f : ds) {
                CacheEntry e;
                try {
                    e = read(f);
                } catch (CacheException bad) {
                    // 손상 항목은 어차피 읽을 수 없으니 정리 대상
                    LOG.warn("removing unreadable cache entry {}: {}", f, bad.getMessage());
                    e = null;
                }
                if (e == null || !e.isLiveAt(nowMillis)) {
                    if (Files.deleteIfExists(f)) removed++;
                }
            }
        } catch (IOException e) {
            throw new CacheException("Failed to sweep cache dir: " + dir, e);
        }
        return removed;
    }

    private void ensureDir() {
        if (dirReady) return;
        try {
            Files.createDirectories(dir);
            dirReady = true;
        } catch (IOException e) {
            throw new CacheException("Failed to create cache dir: " + dir, e);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.debug("tmp cleanup failed for {}: {}", p, e.toString());
        }
    }
}
