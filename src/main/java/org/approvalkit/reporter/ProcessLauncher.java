package org.approvalkit.reporter;

import java.io.IOException;
import java.util.List;

/**
 * Starts an external program without waiting for it.
 */
@FunctionalInterface
public interface ProcessLauncher {
    void launch(List<String> command) throws IOException;

    static ProcessLauncher system() {
        return command -> new ProcessBuilder(command).inheritIO().start();
    }
}
