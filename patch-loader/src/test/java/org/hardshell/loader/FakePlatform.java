package org.hardshell.loader;

import org.hardshell.loader.debug.DebuggerProbe;
import org.hardshell.loader.delegation.ApplicationContract;
import org.hardshell.loader.delegation.DeferredInitializer;
import org.hardshell.loader.delegation.DelegationStrategies;
import org.hardshell.loader.delegation.ReflectiveApplicationContract;
import org.hardshell.share.Logger;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class FakePlatform implements Platform {

    int sdkInt = 29;
    String abi = "x86_64";
    final File privateDir;
    final Map<String, byte[]> assets = new HashMap<>();
    final Map<String, String> metaData = new HashMap<>();
    final RecordingCodeLoader codeLoader = new RecordingCodeLoader();
    DelegationStrategies strategies = new DelegationStrategies();
    ApplicationContract contract = new ReflectiveApplicationContract("attach", "onCreate");
    final List<DeferredInitializer> initializers = new ArrayList<>();
    boolean debuggerAttached;
    final TestLogger logger = new TestLogger();

    FakePlatform(File privateDir) {
        this.privateDir = privateDir;
    }

    @Override
    public int sdkInt() {
        return sdkInt;
    }

    @Override
    public String abi() {
        return abi;
    }

    @Override
    public File privateDir() {
        return privateDir;
    }

    @Override
    public InputStream openStubAsset(String path) {
        byte[] bytes = assets.get(path);
        return bytes == null ? null : new ByteArrayInputStream(bytes);
    }

    @Override
    public String metaData(String key) {
        return metaData.get(key);
    }

    @Override
    public CodeLoader codeLoader() {
        return codeLoader;
    }

    @Override
    public DelegationStrategies delegationStrategies() {
        return strategies;
    }

    @Override
    public ApplicationContract applicationContract() {
        return contract;
    }

    @Override
    public List<DeferredInitializer> deferredInitializers() {
        return initializers;
    }

    @Override
    public DebuggerProbe debuggerProbe() {
        return () -> debuggerAttached;
    }

    @Override
    public Logger logger() {
        return logger;
    }
}
