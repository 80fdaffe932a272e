package com.search.cache.tier;

import com.search.cache.key.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Content-addressed file store: the record for key {@code abcd...} lives at
 * {@code <root>/ab/abcd....rec}. Writes go to a temp file in the same
 * directory and are moved into place.
 */
public class FileSystemColdStore implements ColdStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemColdStore.class);

    static final String RECORD_SUFFIX = ".rec";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    public FileSystemColdStore(Path root) {
        this.root = root.toAbsolutePath();
    }

    Path pathFor(CacheKey key) {
        String hex = key.toHex();
        return root.resolve(hex.substring(0, 2)).resolve(hex + RECORD_SUFFIX);
    }

    @Override
    public void write(CacheKey key, byte[] record) throws IOException {
        Path target = pathFor(key);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), key.shortHex(), TEMP_SUFFIX);
        try {
            Files.write(temp, record);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public Optional<byte[]> read(CacheKey key) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(pathFor(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean delete(CacheKey key) throws IOException {
        return Files.deleteIfExists(pathFor(key));
    }

    @Override
    public List<CacheKey> keys() throws IOException {
        List<CacheKey> keys = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return keys;
        }
        try (DirectoryStream<Path> shards = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path shard : shards) {
                try (DirectoryStream<Path> records = Files.newDirectoryStream(shard, "*" + RECORD_SUFFIX)) {
                    for (Path record : records) {
                        String name = record.getFileName().toString();
                        String hex = name.substring(0, name.length() - RECORD_SUFFIX.length());
                        try {
                            keys.add(CacheKey.fromHex(hex));
                        } catch (IllegalArgumentException e) {
                            log.warn("cold.store.foreign.file path={}", record);
                        }
                    }
                }
            }
        }
        return keys;
    }

    @Override
    public int deleteAll() throws IOException {
        int deleted = 0;
        for (CacheKey key : keys()) {
            if (delete(key)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public boolean probe() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (IOException e) {
            log.debug("cold.store.probe.failed root={} error={}", root, e.getMessage());
            return false;
        }
    }

    @Override
    public String describe() {
        return root.toString();
    }
}
