package com.ashscreener.cache;

import com.ashscreener.model.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 模块说明：FileCacheStore（class）。
 * 主要职责：以扁平目录保存缓存数据，文件名为逻辑键的 MD5，文件修改时间即写入时间。
 * 使用建议：缓存只做加速，读写失败一律按未命中处理，不向上抛出。
 */
public final class FileCacheStore implements CacheStore {
    private static final Logger LOG = LogManager.getLogger(FileCacheStore.class);
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FileCacheStore(Path dir) {
        this(dir, Clock.systemUTC());
    }

    public FileCacheStore(Path dir, Clock clock) {
        this.dir = dir;
        this.clock = clock;
    }

    @Override
    public Optional<Table> get(String logicalKey, double maxAgeHours) {
        Path path = pathFor(logicalKey);
        lock.readLock().lock();
        try {
            if (!Files.isRegularFile(path)) {
                return Optional.empty();
            }
            Instant written = Files.getLastModifiedTime(path).toInstant();
            long maxAgeMillis = (long) (maxAgeHours * 3_600_000L);
            if (Duration.between(written, clock.instant()).toMillis() > maxAgeMillis) {
                return Optional.empty();
            }
            String body = Files.readString(path, StandardCharsets.UTF_8);
            return Optional.of(Table.fromJson(body));
        } catch (Exception e) {
            LOG.debug("cache entry unreadable, key={} path={} err={}", logicalKey, path, e.toString());
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void put(String logicalKey, Table payload) {
        if (payload == null) {
            return;
        }
        Path path = pathFor(logicalKey);
        lock.writeLock().lock();
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            Files.writeString(tmp, payload.toJson(), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            LOG.warn("cache write failed, key={} err={}", logicalKey, e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Instant> lastModified(String logicalKey) {
        Path path = pathFor(logicalKey);
        lock.readLock().lock();
        try {
            if (!Files.isRegularFile(path)) {
                return Optional.empty();
            }
            return Optional.of(Files.getLastModifiedTime(path).toInstant());
        } catch (IOException e) {
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    Path pathFor(String logicalKey) {
        return dir.resolve(hash(logicalKey) + SUFFIX);
    }

    static String hash(String logicalKey) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest((logicalKey == null ? "" : logicalKey).getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
