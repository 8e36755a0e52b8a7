package io.macroq.stage;

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
import java.util.UUID;

public final class FileRecordStore implements RecordStore {
    private static final String SUFFIX = ".rec";

    private final Path dir;

    public FileRecordStore(Path dir) {
        this.dir = dir;
    }

    public Path dir() {
        return dir;
    }

    @Override
    public void init() {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize record directory: " + dir, e);
        }
    }

    @Override
    public void write(String name, byte[] content) {
        Path target = pathOf(name);
        Path tmp = dir.resolve("." + name + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new RuntimeException("Failed to write staged record: " + name, e);
        }
    }

    @Override
    public Optional<byte[]> read(String name) {
        try {
            return Optional.of(Files.readAllBytes(pathOf(name)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read staged record: " + name, e);
        }
    }

    @Override
    public boolean exists(String name) {
        return Files.exists(pathOf(name));
    }

    @Override
    public boolean delete(String name) {
        try {
            return Files.deleteIfExists(pathOf(name));
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete staged record: " + name, e);
        }
    }

    @Override
    public List<String> list() {
        List<String> names = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return names;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path path : stream) {
                String file = path.getFileName().toString();
                if (!file.startsWith(".")) {
                    names.add(file.substring(0, file.length() - SUFFIX.length()));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list staged records in " + dir, e);
        }
        names.sort(String::compareTo);
        return names;
    }

    @Override
    public String describe() {
        return "file:" + dir;
    }

    private Path pathOf(String name) {
        if (!RecordNames.isValid(name)) {
            throw new IllegalArgumentException("invalid record name: " + name);
        }
        return dir.resolve(name + SUFFIX);
    }
}
