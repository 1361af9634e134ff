package com.panorama.API;

import com.panorama.exception.StitchingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class StitchingController {
    private final StitchingService stitchingService;
    private final ImageStorageService imageStorageService;

    public StitchingController(StitchingService stitchingService, ImageStorageService imageStorageService) {
        this.stitchingService = stitchingService;
        this.imageStorageService = imageStorageService;
    }

    /**
     * The first image is warped into the frame of the second.
     */
    @PostMapping(value = "/stitch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> stitchImages(
            @RequestParam(value = "images", required = false) List<MultipartFile> images,
            @RequestParam(value = "seed", required = false) Long seed) {
        if (images == null || images.size() != 2) {
            return error(ResponseEntity.badRequest(), "Exactly two images are required.");
        }
        for (MultipartFile image : images) {
            if (!imageStorageService.isValidImageFile(image)) {
                return error(ResponseEntity.badRequest(), "Invalid image file: " + image.getOriginalFilename());
            }
        }

        String jobId = UUID.randomUUID().toString();
        try {
            List<Path> stored = imageStorageService.storeMultiple(jobId, images);
            StitchingService.StitchSummary summary = stitchingService.stitchImages(jobId, stored.get(0), stored.get(1), seed);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("imageUrl", summary.getImageUrl());
            response.put("correspondences", summary.getCorrespondences());
            response.put("inliers", summary.getInliers());
            return ResponseEntity.ok().body(response);
        } catch (StitchingException e) {
            log.warn("Stitching rejected: {}", e.getMessage());
            return error(ResponseEntity.badRequest(), e.getMessage());
        } catch (Exception e) {
            log.error("Stitching failed", e);
            return error(ResponseEntity.internalServerError(), "Error: " + e.getMessage());
        } finally {
            discardUploads(jobId);
        }
    }

    private void discardUploads(String jobId) {
        try {
            imageStorageService.discard(jobId);
        } catch (IOException e) {
            log.warn("Could not remove uploads of job {}", jobId, e);
        }
    }

    private static ResponseEntity<Map<String, String>> error(ResponseEntity.BodyBuilder builder, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return builder.body(error);
    }
}
