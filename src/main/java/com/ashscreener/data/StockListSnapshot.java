package com.ashscreener.data;

import com.ashscreener.model.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Last successfully fetched stock list, kept outside the TTL cache as a last-resort fallback.
 */
public final class StockListSnapshot {
    private static final Logger LOG = LogManager.getLogger(StockListSnapshot.class);

    private final Path path;

    public StockListSnapshot(Path path) {
        this.path = path;
    }

    public Optional<Table> load() {
        try {
            if (path == null || !Files.isRegularFile(path)) {
                return Optional.empty();
            }
            Table table = Table.fromJson(Files.readString(path, StandardCharsets.UTF_8));
            return table.isEmpty() ? Optional.empty() : Optional.of(table);
        } catch (Exception e) {
            LOG.warn("stock list snapshot unreadable: path={} err={}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(Table table) {
        if (path == null || table == null || table.isEmpty()) {
            return;
        }
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, table.toJson(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("stock list snapshot write failed: path={} err={}", path, e.getMessage());
        }
    }
}
