package org.hardshell.metaloader;

import android.content.pm.ApplicationInfo;
import android.os.Build;
import android.os.Debug;

import org.hardshell.loader.CodeLoader;
import org.hardshell.loader.Platform;
import org.hardshell.loader.debug.DebuggerProbe;
import org.hardshell.loader.debug.TracerPidProbe;
import org.hardshell.loader.delegation.ApplicationContract;
import org.hardshell.loader.delegation.DeferredInitializer;
import org.hardshell.loader.delegation.DelegationStrategies;
import org.hardshell.loader.delegation.ReflectiveApplicationContract;
import org.hardshell.loader.util.Reflection;
import org.hardshell.share.Logger;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

class AndroidPlatform implements Platform {

    private static final Map<String, String> archToAbi = new HashMap<>(4);

    static {
        archToAbi.put("arm", "armeabi-v7a");
        archToAbi.put("arm64", "arm64-v8a");
        archToAbi.put("x86", "x86");
        archToAbi.put("x86_64", "x86_64");
    }

    private final ApplicationInfo appInfo;
    private final ClassLoader stubClassLoader;
    private final Logger logger;

    AndroidPlatform(ApplicationInfo appInfo, ClassLoader stubClassLoader, Logger logger) {
        this.appInfo = appInfo;
        this.stubClassLoader = stubClassLoader;
        this.logger = logger;
    }

    @Override
    public int sdkInt() {
        return Build.VERSION.SDK_INT;
    }

    @Override
    public String abi() {
        try {
            Class<?> vmRuntime = Class.forName("dalvik.system.VMRuntime");
            Object runtime = Reflection.callStaticMethod(vmRuntime, "getRuntime");
            String arch = (String) Reflection.invoke(Reflection.findMethod(vmRuntime, "vmInstructionSet"), runtime);
            String abi = archToAbi.get(arch);
            if (abi != null) return abi;
            logger.w("Unknown instruction set " + arch);
        } catch (ReflectiveOperationException e) {
            logger.e("Cannot query instruction set", e);
        }
        return Build.SUPPORTED_ABIS[0];
    }

    @Override
    public File privateDir() {
        return new File(appInfo.dataDir);
    }

    @Override
    public InputStream openStubAsset(String path) throws IOException {
        var is = stubClassLoader.getResourceAsStream(path);
        if (is == null) throw new FileNotFoundException(path);
        return is;
    }

    @Override
    public String metaData(String key) {
        return appInfo.metaData == null ? null : appInfo.metaData.getString(key);
    }

    @Override
    public CodeLoader codeLoader() {
        return new AndroidCodeLoader(stubClassLoader, appInfo.nativeLibraryDir);
    }

    @Override
    public DelegationStrategies delegationStrategies() {
        return new DelegationStrategies()
                .register(ActivityThreadDelegation.MIN_SDK, ActivityThreadDelegation.MAX_SDK, new ActivityThreadDelegation());
    }

    @Override
    public ApplicationContract applicationContract() {
        return new ReflectiveApplicationContract("attach", "onCreate");
    }

    @Override
    public List<DeferredInitializer> deferredInitializers() {
        return Collections.singletonList(new WorkManagerInitializer());
    }

    @Override
    public DebuggerProbe debuggerProbe() {
        var tracer = new TracerPidProbe();
        return () -> Debug.isDebuggerConnected() || tracer.isDebuggerAttached();
    }

    @Override
    public Logger logger() {
        return logger;
    }
}
