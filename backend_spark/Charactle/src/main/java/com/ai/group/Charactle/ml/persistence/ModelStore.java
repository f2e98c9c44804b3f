package com.ai.group.Charactle.ml.persistence;

import com.ai.group.Charactle.ml.pipeline.FittedModelState;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File-backed persistence of fitted states. Saves go to a sibling temp file that is then moved over
 * the target, so readers see either the old model or the new one.
 */
@Slf4j
public class ModelStore {

    private final ModelStateCodec codec;

    public ModelStore(ModelStateCodec codec) {
        this.codec = codec;
    }

    public void save(FittedModelState state, Path path) throws IOException {
        byte[] blob = codec.save(state);
        Path target = path.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                out.write(blob);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Saved decision tree model ({} bytes) to {}", blob.length, target);
    }

    public FittedModelState load(Path path) throws IOException {
        byte[] blob;
        try (InputStream in = Files.newInputStream(path)) {
            blob = in.readAllBytes();
        }
        FittedModelState state = codec.load(blob);
        log.info("Loaded decision tree model ({} bytes) from {}", blob.length, path.toAbsolutePath());
        return state;
    }

    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }
}
