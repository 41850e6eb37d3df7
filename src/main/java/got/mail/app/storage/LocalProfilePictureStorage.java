package got.mail.app.storage;

import got.mail.app.exception.StorageException;
import got.mail.app.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps profile pictures on the local filesystem under
 * {@code gotmail.storage.profile-pictures-dir}. References are file names relative to it.
 */
@Slf4j
@Component
public class LocalProfilePictureStorage implements ProfilePictureStorage {
    private static final Set<String> ALLOWED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "webp");

    private final Path baseDirectory;

    public LocalProfilePictureStorage(@Value("${gotmail.storage.profile-pictures-dir}") String baseDirectory) {
        this.baseDirectory = Path.of(baseDirectory).toAbsolutePath().normalize();
    }

    @Override
    public String store(String ownerId, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Invalid profile picture",
                    Map.of("profile_picture", "The submitted file is empty."));
        }
        String extension = StringUtils.getFilenameExtension(file.getOriginalFilename());
        if (extension == null || !ALLOWED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
            throw new ValidationException("Invalid profile picture",
                    Map.of("profile_picture", "Upload a valid image (png, jpg, gif or webp)."));
        }

        String reference = ownerId + "-" + UUID.randomUUID() + "." + extension.toLowerCase(Locale.ROOT);
        Path target = baseDirectory.resolve(reference);
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(baseDirectory);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to store profile picture", e);
        }
        log.debug("Stored profile picture {} ({} bytes)", reference, file.getSize());
        return reference;
    }

    @Override
    public void delete(String reference) {
        if (reference == null || reference.isBlank()) {
            return;
        }
        Path target = baseDirectory.resolve(reference).normalize();
        if (!target.startsWith(baseDirectory)) {
            log.warn("Refusing to delete profile picture outside storage directory: {}", reference);
            return;
        }
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            // The profile change already happened, a stray file is only wasted space
            log.warn("Could not delete profile picture {}: {}", reference, e.getMessage());
        }
    }
}
