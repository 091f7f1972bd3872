package org.hardshell.loader;

public enum LoaderState {
    INIT,
    KEY_RESOLVED,
    STRATEGY_SELECTED,
    CODE_LOADED,
    NATIVE_READY,
    DELEGATED,
    RUNNING,
    FAILED;

    /**
     * @return the only state this one may advance to, or {@code null} for terminal states
     */
    public LoaderState successor() {
        if (this == RUNNING || this == FAILED) return null;
        return values()[ordinal() + 1];
    }

    public boolean isTerminal() {
        return this == RUNNING || this == FAILED;
    }
}
