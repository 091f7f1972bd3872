package org.hardshell.share;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Written by the packer into the hardened apk and read back by the loader before anything else runs.
 */
public class BootstrapConfig {

    public final int formatVersion;
    public final String originalApplication;
    public final String originalAppComponentFactory;
    public final int minSdkVersion;
    public final int targetSdkVersion;
    public final String keyScheme;
    public final List<String> keyShares;
    public final String debuggerPolicy;

    public BootstrapConfig(
            String originalApplication,
            String originalAppComponentFactory,
            int minSdkVersion,
            int targetSdkVersion,
            String keyScheme,
            List<String> keyShares,
            String debuggerPolicy
    ) {
        this.formatVersion = Constants.BOOTSTRAP_FORMAT_VERSION;
        this.originalApplication = originalApplication;
        this.originalAppComponentFactory = originalAppComponentFactory;
        this.minSdkVersion = minSdkVersion;
        this.targetSdkVersion = targetSdkVersion;
        this.keyScheme = keyScheme;
        this.keyShares = keyShares == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(keyShares));
        this.debuggerPolicy = debuggerPolicy;
    }

    public byte[] toJson() {
        return new Gson().toJson(this).getBytes(StandardCharsets.UTF_8);
    }

    public static BootstrapConfig fromJson(InputStream is) throws IOException {
        if (is == null) throw new IOException("bootstrap config not found");
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            var config = new Gson().fromJson(reader, BootstrapConfig.class);
            if (config == null) throw new IOException("empty bootstrap config");
            if (config.formatVersion != Constants.BOOTSTRAP_FORMAT_VERSION)
                throw new IOException("unsupported bootstrap config version " + config.formatVersion);
            return config;
        } catch (JsonParseException e) {
            throw new IOException("malformed bootstrap config", e);
        }
    }
}
