package io.macroq.stage;

import java.util.List;
import java.util.Optional;

public interface RecordStore {
    void init();

    void write(String name, byte[] content);

    Optional<byte[]> read(String name);

    boolean exists(String name);

    boolean delete(String name);

    List<String> list();

    String describe();
}
