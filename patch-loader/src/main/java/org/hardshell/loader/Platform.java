package org.hardshell.loader;

import org.hardshell.loader.debug.DebuggerProbe;
import org.hardshell.loader.delegation.ApplicationContract;
import org.hardshell.loader.delegation.DeferredInitializer;
import org.hardshell.loader.delegation.DelegationStrategies;
import org.hardshell.share.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Everything the loader needs from the process it runs in.
 */
public interface Platform {

    int sdkInt();

    /**
     * Primary ABI of the running process, e.g. {@code arm64-v8a}.
     */
    String abi();

    /**
     * App-private storage root; the loader only writes below {@code hardshell/} in it.
     */
    File privateDir();

    /**
     * Opens an entry of the hardened apk itself, such as the bootstrap config.
     */
    InputStream openStubAsset(String path) throws IOException;

    /**
     * Manifest meta-data value, or {@code null} when absent or not yet available.
     */
    String metaData(String key);

    CodeLoader codeLoader();

    DelegationStrategies delegationStrategies();

    ApplicationContract applicationContract();

    List<DeferredInitializer> deferredInitializers();

    DebuggerProbe debuggerProbe();

    Logger logger();
}
