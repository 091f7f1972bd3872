package org.hardshell.loader;

import org.hardshell.loader.delegation.DelegationStrategy;
import org.hardshell.share.Logger;
import org.hardshell.share.crypto.AuthenticationFailureException;
import org.hardshell.share.payload.EntryKind;
import org.hardshell.share.payload.PayloadContainer;
import org.hardshell.share.payload.PayloadCorruptException;
import org.hardshell.share.payload.PayloadCrypto;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.security.GeneralSecurityException;

/**
 * State of one loader run. Transitions only ever go to the direct successor or to {@link LoaderState#FAILED}.
 */
public final class LoaderSession implements LibraryLookup {

    private final Logger logger;
    private volatile LoaderState state = LoaderState.INIT;
    private volatile LoaderFailure failure;

    byte[] key;
    int sdkInt;
    LoadingStrategy strategy;
    PayloadContainer container;
    ClassLoader classLoader;
    volatile LibraryLookup nativeLibraries;
    String originalApplication;
    String originalAppComponentFactory;
    DelegationStrategy delegation;
    Object original;
    Object application;

    LoaderSession(Logger logger) {
        this.logger = logger;
    }

    public LoaderState state() {
        return state;
    }

    /**
     * @return the failure that ended this session, or {@code null}
     */
    public LoaderFailure failure() {
        return failure;
    }

    synchronized void advance(LoaderState next) {
        if (state.successor() != next)
            throw new IllegalStateException("illegal transition " + state + " -> " + next);
        logger.d("Loader state " + state + " -> " + next);
        state = next;
    }

    /**
     * Moves to {@link LoaderState#FAILED} and returns the failure for the caller to throw.
     */
    synchronized LoaderFailure fail(LoaderFailure cause) {
        if (state != LoaderState.FAILED) {
            logger.e("Loader failed in " + state, cause);
            state = LoaderState.FAILED;
            failure = cause;
        }
        return cause;
    }

    LoaderFailure fail(LoaderFailure.Reason reason, String message, Throwable cause) {
        return fail(new LoaderFailure(reason, message, cause));
    }

    public int sdkInt() {
        return sdkInt;
    }

    public LoadingStrategy strategy() {
        return strategy;
    }

    /**
     * Loader holding the decrypted code, available from {@link LoaderState#CODE_LOADED} on.
     */
    public ClassLoader classLoader() {
        return classLoader;
    }

    public String originalApplication() {
        return originalApplication;
    }

    public String originalAppComponentFactory() {
        return originalAppComponentFactory;
    }

    /**
     * The original application instance once delegation has happened.
     */
    public Object application() {
        return application;
    }

    @Override
    public String findLibrary(String name) {
        var natives = nativeLibraries;
        if (natives == null) return null;
        try {
            return natives.findLibrary(name);
        } catch (LoaderFailure e) {
            throw fail(e);
        } catch (RuntimeException e) {
            throw fail(LoaderFailure.Reason.UNSUPPORTED_PLATFORM_CAPABILITY, "cannot resolve " + name, e);
        }
    }

    /**
     * Decrypts a protected asset.
     *
     * @param path full entry path, starting with {@code assets/}
     * @return the asset content, or {@code null} when {@code path} was not protected
     */
    public InputStream openAsset(String path) {
        var c = container;
        if (c == null) throw new IllegalStateException("payload not loaded yet");
        var entry = c.find(EntryKind.ASSET, path, "");
        if (entry == null) return null;
        try {
            return new ByteArrayInputStream(PayloadCrypto.open(entry, key));
        } catch (AuthenticationFailureException e) {
            throw fail(LoaderFailure.Reason.AUTHENTICATION_FAILURE, path, e);
        } catch (PayloadCorruptException e) {
            throw fail(LoaderFailure.Reason.PAYLOAD_CORRUPT, path, e);
        } catch (GeneralSecurityException e) {
            throw fail(LoaderFailure.Reason.AUTHENTICATION_FAILURE, "cannot decrypt " + path, e);
        }
    }
}
