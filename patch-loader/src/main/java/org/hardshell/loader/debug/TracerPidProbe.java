package org.hardshell.loader.debug;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reports a debugger when the kernel lists a non-zero {@code TracerPid} for this process.
 */
public final class TracerPidProbe implements DebuggerProbe {

    private static final String PREFIX = "TracerPid:";

    private final File status;

    public TracerPidProbe() {
        this(new File("/proc/self/status"));
    }

    public TracerPidProbe(File status) {
        this.status = status;
    }

    @Override
    public boolean isDebuggerAttached() throws IOException {
        try (var reader = new BufferedReader(new InputStreamReader(new FileInputStream(status), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(PREFIX)) {
                    String pid = line.substring(PREFIX.length()).trim();
                    try {
                        return Integer.parseInt(pid) != 0;
                    } catch (NumberFormatException e) {
                        throw new IOException("unreadable TracerPid: " + pid, e);
                    }
                }
            }
        }
        return false;
    }
}
