package org.hardshell.loader.debug;

import java.io.IOException;

public interface DebuggerProbe {

    boolean isDebuggerAttached() throws IOException;
}
