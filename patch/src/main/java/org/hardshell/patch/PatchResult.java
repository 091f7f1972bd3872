package org.hardshell.patch;

import com.google.common.collect.ImmutableList;

import java.io.File;
import java.util.List;

public final class PatchResult {

    private final File output;
    private final ImmutableList<PatchWarning> warnings;
    private final int protectedCodeUnits;
    private final int protectedLibraries;
    private final int protectedAssets;
    private final boolean signed;

    PatchResult(File output, List<PatchWarning> warnings, int protectedCodeUnits, int protectedLibraries,
                int protectedAssets, boolean signed) {
        this.output = output;
        this.warnings = ImmutableList.copyOf(warnings);
        this.protectedCodeUnits = protectedCodeUnits;
        this.protectedLibraries = protectedLibraries;
        this.protectedAssets = protectedAssets;
        this.signed = signed;
    }

    public File output() {
        return output;
    }

    public List<PatchWarning> warnings() {
        return warnings;
    }

    public boolean hasWarning(PatchWarning.Kind kind) {
        for (PatchWarning warning : warnings) {
            if (warning.kind() == kind) return true;
        }
        return false;
    }

    public int protectedCodeUnits() {
        return protectedCodeUnits;
    }

    public int protectedLibraries() {
        return protectedLibraries;
    }

    public int protectedAssets() {
        return protectedAssets;
    }

    public boolean isSigned() {
        return signed;
    }
}
