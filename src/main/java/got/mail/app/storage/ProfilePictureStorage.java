package got.mail.app.storage;

import org.springframework.web.multipart.MultipartFile;

/**
 * Where uploaded profile pictures live. Implementations return an opaque reference that
 * is stored on the profile and later passed back to {@link #delete(String)}.
 */
public interface ProfilePictureStorage {
    String store(String ownerId, MultipartFile file);

    void delete(String reference);
}
