package com.example.webvttlayer.controller;

import com.example.webvttlayer.model.CueData;
import com.example.webvttlayer.model.FileEntry;
import com.example.webvttlayer.model.ParseResponse;
import com.example.webvttlayer.parser.Cue;
import com.example.webvttlayer.parser.VttFormatException;
import com.example.webvttlayer.service.CueService;
import com.example.webvttlayer.service.WebVttParser;
import com.example.webvttlayer.service.WebVttWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for parsing and retiming WebVTT documents.
 */
@RestController
@RequestMapping("/api/v1")
public class CueController {

    private static final Logger log = LoggerFactory.getLogger(CueController.class);

    private final WebVttParser parser;
    private final WebVttWriter writer;
    private final CueService cueService;

    public CueController(WebVttParser parser, WebVttWriter writer, CueService cueService) {
        this.parser = parser;
        this.writer = writer;
        this.cueService = cueService;
    }

    /**
     * POST /api/v1/parse - Parse a WebVTT document sent as the request body.
     */
    @PostMapping("/parse")
    public ResponseEntity<?> parse(@RequestBody byte[] content) {
        try {
            List<Cue> cues = parser.parse(content);
            return ResponseEntity.ok(toResponse(null, cues));
        } catch (VttFormatException e) {
            return badRequest("Invalid WebVTT: " + e.getMessage());
        } catch (IOException e) {
            log.error("Parse request failed", e);
            return serverError("Parse failed: " + e.getMessage());
        }
    }

    /**
     * POST /api/v1/upload - Parse an uploaded WebVTT file.
     */
    @PostMapping("/upload")
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file) {
        log.info("Parsing uploaded file: {}", file.getOriginalFilename());

        try (InputStream in = file.getInputStream()) {
            List<Cue> cues = parser.parse(in);
            return ResponseEntity.ok(toResponse(file.getOriginalFilename(), cues));
        } catch (VttFormatException e) {
            return badRequest("Invalid WebVTT in " + file.getOriginalFilename() + ": " + e.getMessage());
        } catch (IOException e) {
            log.error("Upload failed for file: {}", file.getOriginalFilename(), e);
            return serverError("Upload failed: " + e.getMessage());
        }
    }

    /**
     * POST /api/v1/shift - Move every cue by offset_ms and return the
     * resulting WebVTT document.
     */
    @PostMapping("/shift")
    public ResponseEntity<?> shift(
            @RequestParam("offset_ms") long offsetMs,
            @RequestBody byte[] content) {

        try {
            List<Cue> shifted = cueService.shift(parser.parse(content), offsetMs);
            return ResponseEntity.ok()
                    .header("Content-Type", "text/vtt; charset=utf-8")
                    .body(writer.generateVtt(shifted));
        } catch (VttFormatException e) {
            return badRequest("Invalid WebVTT: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return badRequest("Invalid offset: " + e.getMessage());
        } catch (IOException e) {
            log.error("Shift request failed", e);
            return serverError("Shift failed: " + e.getMessage());
        }
    }

    /**
     * GET /api/v1/files - List WebVTT files in the subtitle directory.
     */
    @GetMapping("/files")
    public ResponseEntity<?> listFiles() {
        try {
            List<FileEntry> files = cueService.listFiles();
            return ResponseEntity.ok(Map.of("total_count", files.size(), "data", files));
        } catch (IOException e) {
            log.error("Listing subtitle directory failed", e);
            return serverError("Listing failed: " + e.getMessage());
        }
    }

    /**
     * GET /api/v1/files/{name} - Parse a file from the subtitle directory.
     */
    @GetMapping("/files/{name}")
    public ResponseEntity<?> parseFile(@PathVariable String name) {
        try {
            return ResponseEntity.ok(toResponse(name, cueService.parseFile(name)));
        } catch (NoSuchFileException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "message", "File not found: " + name,
                    "status", 404));
        } catch (AccessDeniedException e) {
            return badRequest("Access denied: " + name);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (VttFormatException e) {
            return badRequest("Invalid WebVTT in " + name + ": " + e.getMessage());
        } catch (IOException e) {
            log.error("Parsing file {} failed", name, e);
            return serverError("Parse failed: " + e.getMessage());
        }
    }

    private static ParseResponse toResponse(String fileName, List<Cue> cues) {
        List<CueData> data = cues.stream().map(CueData::from).toList();
        return new ParseResponse(fileName, data.size(), data);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of(
                "message", message,
                "status", 400));
    }

    private static ResponseEntity<Map<String, Object>> serverError(String message) {
        return ResponseEntity.internalServerError().body(Map.of(
                "message", message,
                "status", 500));
    }
}
