package org.hardshell.patch;

public class PatchCancelledException extends PatchError {

    public PatchCancelledException(String stage) {
        super("Cancelled before " + stage);
    }
}
