package org.iceforge.cloudstorage.facade;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Application-level identity of a stored file. Written to the object's user metadata so the
 * cache tags of an object can be rebuilt from the store alone.
 */
public record FileMetadata(String fileId, String ownerId, String folderId, String contentType) {

    static final String FILE_ID = "file-id";
    static final String OWNER_ID = "owner-id";
    static final String FOLDER_ID = "folder-id";

    public static String fileTag(String fileId) { return "file:" + fileId; }
    public static String userTag(String ownerId) { return "user:" + ownerId; }
    public static String folderTag(String folderId) { return "folder:" + folderId; }

    /** Cache tags of this file; absent ids contribute no tag. */
    public Set<String> tags() {
        Set<String> tags = new LinkedHashSet<>();
        if (fileId != null) tags.add(fileTag(fileId));
        if (ownerId != null) tags.add(userTag(ownerId));
        if (folderId != null) tags.add(folderTag(folderId));
        return Set.copyOf(tags);
    }

    public Map<String, String> toUserMetadata() {
        Map<String, String> m = new HashMap<>();
        if (fileId != null) m.put(FILE_ID, fileId);
        if (ownerId != null) m.put(OWNER_ID, ownerId);
        if (folderId != null) m.put(FOLDER_ID, folderId);
        return Map.copyOf(m);
    }

    public static FileMetadata fromUserMetadata(Map<String, String> userMetadata, String contentType) {
        Map<String, String> m = userMetadata == null ? Map.of() : userMetadata;
        return new FileMetadata(m.get(FILE_ID), m.get(OWNER_ID), m.get(FOLDER_ID), contentType);
    }
}
