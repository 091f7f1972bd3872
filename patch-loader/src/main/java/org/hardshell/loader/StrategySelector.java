package org.hardshell.loader;

public final class StrategySelector {

    /**
     * First platform level with {@code dalvik.system.InMemoryDexClassLoader}.
     */
    public static final int IN_MEMORY_MIN_SDK = 26;

    private StrategySelector() {
    }

    public static LoadingStrategy select(int sdkInt) {
        return sdkInt >= IN_MEMORY_MIN_SDK ? LoadingStrategy.IN_MEMORY : LoadingStrategy.FILE_BASED;
    }
}
