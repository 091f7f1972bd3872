package org.hardshell.patch.task;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.hardshell.patch.util.ApkEntry;
import org.hardshell.share.Logger;

import java.io.File;
import java.io.IOException;
import java.util.GregorianCalendar;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.CRC32;
import java.util.zip.Deflater;

/**
 * Writes entries in the given order with fixed timestamps. Stored entries start on a 4 byte boundary and native
 * libraries on a page boundary, which is what zipalign produces.
 */
public class WriteApkTask {

    public static final int DEFAULT_ALIGNMENT = 4;
    public static final int LIBRARY_ALIGNMENT = 4096;

    // 1981-01-01 00:00, the earliest time every zip tool represents identically
    private static final long FIXED_TIME = new GregorianCalendar(1981, 0, 1, 0, 0, 0).getTimeInMillis();

    private final Logger logger;

    public WriteApkTask(Logger logger) {
        this.logger = logger;
    }

    public void write(File output, List<ApkEntry> entries) throws IOException {
        Set<String> seen = new HashSet<>();
        try (var zip = new ZipArchiveOutputStream(output)) {
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            for (ApkEntry entry : entries) {
                if (!seen.add(entry.name())) throw new IOException("duplicate entry " + entry.name());
                var zipEntry = new ZipArchiveEntry(entry.name());
                zipEntry.setTime(FIXED_TIME);
                byte[] data = entry.data();
                if (entry.compressed()) {
                    zipEntry.setMethod(ZipArchiveEntry.DEFLATED);
                } else {
                    var crc = new CRC32();
                    crc.update(data);
                    zipEntry.setMethod(ZipArchiveEntry.STORED);
                    zipEntry.setSize(data.length);
                    zipEntry.setCompressedSize(data.length);
                    zipEntry.setCrc(crc.getValue());
                    zipEntry.setAlignment(entry.name().endsWith(".so") ? LIBRARY_ALIGNMENT : DEFAULT_ALIGNMENT);
                }
                zip.putArchiveEntry(zipEntry);
                zip.write(data);
                zip.closeArchiveEntry();
                logger.d("  " + entry);
            }
            zip.finish();
        }
    }
}
