package com.keelson.core.attachment;

import com.keelson.core.config.KeelsonProperties;
import com.keelson.core.engine.ActionRejectedException;
import com.keelson.core.model.AttachmentKind;
import com.keelson.core.model.AttachmentRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Content-addressed attachment storage. An attachment's id is the SHA-256 of its bytes,
 * so uploading the same file twice yields the same reference.
 * <p>
 * Files live at {@code <dir>/<workdirId>/<id>[.<ext>]}.
 */
@Service
public class AttachmentStore {

    private static final Logger log = LoggerFactory.getLogger(AttachmentStore.class);

    private final Path root;
    private final long maxBytes;
    private final ConcurrentHashMap<String, AttachmentRef> refs = new ConcurrentHashMap<>();

    @Autowired
    public AttachmentStore(KeelsonProperties properties) {
        this(Path.of(properties.getAttachments().getDir()), properties.getAttachments().getMaxBytes());
    }

    AttachmentStore(Path root, long maxBytes) {
        this.root = root;
        this.maxBytes = maxBytes;
    }

    /**
     * Stores an upload for a workdir.
     *
     * @throws ActionRejectedException when the upload is empty or too large
     * @throws IOException             when the file cannot be written
     */
    public AttachmentRef store(long workdirId, String originalName, String mime, byte[] bytes) throws IOException {
        if (bytes.length == 0) {
            throw new ActionRejectedException("attachment is empty");
        }
        if (bytes.length > maxBytes) {
            throw new ActionRejectedException("attachment exceeds " + maxBytes + " bytes");
        }
        String id = sha256(bytes);
        String name = originalName == null || originalName.isBlank() ? id : Path.of(originalName).getFileName().toString();
        String extension = extensionOf(name);
        AttachmentRef ref = new AttachmentRef(id, AttachmentKind.fromMime(mime), name, extension,
                mime == null ? "application/octet-stream" : mime, bytes.length);

        Path dir = root.resolve(String.valueOf(workdirId));
        Files.createDirectories(dir);
        Path target = dir.resolve(fileName(id, extension));
        if (!Files.exists(target)) {
            Path tmp = Files.createTempFile(dir, id, ".part");
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored attachment {} ({} bytes) for workdir {}", id, bytes.length, workdirId);
        }
        refs.putIfAbsent(key(workdirId, id), ref);
        return refs.get(key(workdirId, id));
    }

    public Optional<AttachmentRef> find(long workdirId, String attachmentId) {
        return Optional.ofNullable(refs.get(key(workdirId, attachmentId)));
    }

    /**
     * Reads the bytes of a stored attachment.
     */
    public Optional<StoredAttachment> load(long workdirId, String attachmentId) throws IOException {
        AttachmentRef ref = refs.get(key(workdirId, attachmentId));
        if (ref == null) {
            return Optional.empty();
        }
        Path file = root.resolve(String.valueOf(workdirId)).resolve(fileName(ref.id(), ref.extension()));
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(new StoredAttachment(ref, Files.readAllBytes(file)));
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.matches("[a-z0-9]{1,16}") ? ext : "";
    }

    private static String fileName(String id, String extension) {
        return extension.isEmpty() ? id : id + "." + extension;
    }

    private static String key(long workdirId, String attachmentId) {
        return workdirId + "/" + attachmentId;
    }

    public record StoredAttachment(AttachmentRef ref, byte[] bytes) {}
}
