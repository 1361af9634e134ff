package com.panorama.API;

import com.panorama.osDirectoriesCreate.CreateFolderOrFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class ImageStorageService {
    private final Path uploadsPath;

    public ImageStorageService(StitchingProperties properties) {
        this.uploadsPath = Paths.get(properties.getUploadsDir());
    }

    /**
     * Saves the files of one request in their own folder under the uploads directory, keeping
     * their order. Uploads of other requests are left alone.
     *
     * @return saved paths, in upload order
     */
    public List<Path> storeMultiple(String jobId, List<MultipartFile> files) throws IOException {
        Path jobPath = CreateFolderOrFile.createFolder(jobPath(jobId));

        List<Path> savedPaths = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            // prefix keeps A/B order and separates uploads that share a name
            Path targetPath = jobPath.resolve(i + "_" + safeFilename(file.getOriginalFilename()));
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            savedPaths.add(targetPath);
            log.debug("Stored upload {} as {}", file.getOriginalFilename(), targetPath);
        }
        return savedPaths;
    }

    /** Removes the uploads of one request. */
    public void discard(String jobId) throws IOException {
        CreateFolderOrFile.deleteFolder(jobPath(jobId));
    }

    Path jobPath(String jobId) {
        Path jobPath = uploadsPath.resolve(jobId).normalize();
        if (!uploadsPath.normalize().equals(jobPath.getParent())) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        return jobPath;
    }

    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|tif|tiff|webp)$");
    }

    public Path getUploadsPath() {
        return uploadsPath;
    }

    private static String safeFilename(String original) {
        if (original == null || original.isEmpty()) {
            return "image_" + System.currentTimeMillis() + ".png";
        }
        return Paths.get(original).getFileName().toString();
    }
}
