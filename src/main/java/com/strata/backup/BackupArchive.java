package com.strata.backup;

import com.strata.storage.LocalFiles;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Zip packing of backup content. Compression is applied to the whole archive
 * afterwards, so entries are stored without deflate.
 */
final class BackupArchive {

    private BackupArchive() {
    }

    /**
     * Pack entries in iteration order.
     */
    static byte[] pack(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            zip.setLevel(0);
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue());
                zip.closeEntry();
            }
        }
        return buffer.toByteArray();
    }

    /**
     * Extract every entry below {@code root}. The first entry resolving outside
     * the root aborts the extraction with an integrity violation.
     *
     * @return extracted files
     */
    static List<Path> extract(byte[] archive, Path root) throws IOException {
        List<Path> extracted = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path target = LocalFiles.resolveInside(root, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                Files.copy(zip, target);
                extracted.add(target);
            }
        }
        return extracted;
    }
}
