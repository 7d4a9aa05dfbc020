package com.keelson.dispatch.api;

import com.keelson.core.attachment.AttachmentStore;
import com.keelson.core.engine.ActionRejectedException;
import com.keelson.core.model.AttachmentRef;
import com.keelson.core.workdir.WorkdirRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

/**
 * Upload and download of attachment blobs. Uploads return the {@link AttachmentRef} that
 * clients then reference by id in {@code send_agent_message}.
 */
@RestController
@RequestMapping({"/api/workspaces/{workdirId}/attachments", "/api/workdirs/{workdirId}/attachments"})
public class AttachmentController {

    private static final Logger log = LoggerFactory.getLogger(AttachmentController.class);

    private final AttachmentStore store;
    private final WorkdirRegistry workdirs;

    public AttachmentController(AttachmentStore store, WorkdirRegistry workdirs) {
        this.store = store;
        this.workdirs = workdirs;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> upload(@PathVariable long workdirId, @RequestParam("file") MultipartFile file) {
        if (workdirs.find(workdirId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        try {
            AttachmentRef ref = store.store(workdirId, file.getOriginalFilename(), file.getContentType(), file.getBytes());
            return ResponseEntity.ok(ref);
        } catch (ActionRejectedException e) {
            log.debug("Attachment rejected for workdir {}: {}", workdirId, e.getMessage());
            HttpStatus status = file.isEmpty() ? HttpStatus.BAD_REQUEST : HttpStatus.PAYLOAD_TOO_LARGE;
            return ResponseEntity.status(status).body(Map.of("error", e.getMessage()));
        } catch (IOException e) {
            log.warn("Failed to store attachment for workdir {}: {}", workdirId, e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of("error", "failed to store attachment"));
        }
    }

    @GetMapping("/{attachmentId}")
    public ResponseEntity<byte[]> download(@PathVariable long workdirId, @PathVariable String attachmentId) {
        try {
            return store.load(workdirId, attachmentId)
                    .map(stored -> ResponseEntity.ok()
                            .contentType(MediaType.parseMediaType(stored.ref().mime()))
                            .header(HttpHeaders.CONTENT_DISPOSITION,
                                    ContentDisposition.inline().filename(stored.ref().name()).build().toString())
                            .body(stored.bytes()))
                    .orElse(ResponseEntity.notFound().build());
        } catch (IOException e) {
            log.warn("Failed to read attachment {} of workdir {}: {}", attachmentId, workdirId, e.getMessage());
            return ResponseEntity.internalServerError().build();
        }
    }
}
