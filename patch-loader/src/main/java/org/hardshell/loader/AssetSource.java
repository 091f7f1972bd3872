package org.hardshell.loader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens assets that are still stored in the package, by name relative to {@code assets/}.
 */
public interface AssetSource {

    InputStream open(String name) throws IOException;
}
