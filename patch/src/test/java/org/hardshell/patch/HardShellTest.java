package org.hardshell.patch;

import com.beust.jcommander.ParameterException;

import org.hardshell.patch.util.JavaLogger;
import org.hardshell.share.DebuggerPolicy;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HardShellTest {

    @Test
    void mapsArgumentsToOptions() {
        var cli = new HardShell(new JavaLogger(), "in.apk", "-o", "out.apk", "-f", "-d",
                "--keep-class", "com.example.Foo", "--keep-package", "okhttp3", "--keep-lib", "foo,bar",
                "--encrypt-assets", "assets/*.json", "--debugger-policy", "abort", "-j", "2", "--skip-sign");

        var options = cli.toOptions();

        assertEquals(new File("in.apk").getAbsoluteFile(), options.target);
        assertEquals(new File("out.apk").getAbsoluteFile(), options.output);
        assertTrue(options.forceOverwrite);
        assertTrue(options.debuggable);
        assertEquals(List.of("com.example.Foo"), options.keepClasses);
        assertEquals(List.of("okhttp3"), options.keepPackages);
        assertEquals(List.of("foo", "bar"), options.keepLibraries);
        assertEquals(List.of("assets/*.json"), options.assetPatterns);
        assertEquals(DebuggerPolicy.ABORT, options.debuggerPolicy);
        assertEquals(2, options.threads);
        assertTrue(options.skipSigning);
        assertNull(options.keystore);
        assertNull(options.stubBundle);
    }

    @Test
    void rejectsUnknownPolicies() {
        var cli = new HardShell(new JavaLogger(), "in.apk", "-o", "out.apk", "--debugger-policy", "sometimes");

        assertThrows(ParameterException.class, cli::toOptions);
    }

    @Test
    void printsUsageWithoutTarget() throws PatchError {
        assertNull(new HardShell(new JavaLogger(), "-o", "out.apk").doCommandLine());
        assertNull(new HardShell(new JavaLogger(), "-h").doCommandLine());
    }
}
