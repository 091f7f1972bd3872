package org.hardshell.patch;

/**
 * The input is an app bundle, an apk set, or one part of a split installation.
 */
public class UnsupportedSplitConfigurationError extends PatchError {

    public UnsupportedSplitConfigurationError(String message) {
        super(message);
    }
}
